package com.flamingo.ai.knowledge.cli;

import com.flamingo.ai.knowledge.service.conversion.DocumentTextConverter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** Converts every DOCX file of a directory into a plain-text file. */
@Slf4j
@Component
@RequiredArgsConstructor
@Command(
    name = "docx-to-text",
    description = "Convert DOCX files to plain text with heading separators",
    mixinStandardHelpOptions = true)
public class DocxToTextCommand implements Callable<Integer> {

  private final DocumentTextConverter converter;

  @Spec private CommandSpec spec;

  @Parameters(index = "0", paramLabel = "INPUT_DIR", description = "Directory with .docx files")
  private Path inputDir;

  @Parameters(index = "1", paramLabel = "OUTPUT_DIR", description = "Destination directory")
  private Path outputDir;

  @Override
  public Integer call() {
    List<Path> written = converter.convertDirectory(inputDir, outputDir);
    for (Path target : written) {
      spec.commandLine().getOut().println("Wrote " + target);
    }
    log.info("Converted {} documents into {}", written.size(), outputDir);
    return 0;
  }
}
