package com.flamingo.ai.knowledge;

import com.flamingo.ai.knowledge.cli.KnowledgeCli;
import com.flamingo.ai.knowledge.exception.CommandExceptionHandler;
import java.util.Arrays;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import picocli.CommandLine;

/** Entry point: runs the picocli command tree inside a non-web Spring context. */
@SpringBootApplication
@RequiredArgsConstructor
public class KnowledgeBuilderApplication implements CommandLineRunner, ExitCodeGenerator {

  /** {@code --some.property=value}: consumed by Spring's environment, not by the commands. */
  private static final Pattern PROPERTY_ARG =
      Pattern.compile("^--[A-Za-z][\\w-]*\\.[\\w.\\[\\]-]*=.*");

  private final KnowledgeCli knowledgeCli;
  private final CommandLine.IFactory commandFactory;
  private final CommandExceptionHandler exceptionHandler;

  private int exitCode;

  public static void main(String[] args) {
    System.exit(
        SpringApplication.exit(SpringApplication.run(KnowledgeBuilderApplication.class, args)));
  }

  @Override
  public void run(String... args) {
    exitCode = commandLine().execute(commandArguments(args));
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  /** Builds the command tree with Spring-managed commands and the shared exception handler. */
  public CommandLine commandLine() {
    return new CommandLine(knowledgeCli, commandFactory)
        .setExecutionExceptionHandler(exceptionHandler);
  }

  static String[] commandArguments(String[] args) {
    return Arrays.stream(args)
        .filter(arg -> !PROPERTY_ARG.matcher(arg).matches())
        .toArray(String[]::new);
  }
}
