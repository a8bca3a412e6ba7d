package com.flamingo.ai.knowledge.cli;

import com.flamingo.ai.knowledge.model.KnowledgeBase;
import com.flamingo.ai.knowledge.model.SourceDocument;
import com.flamingo.ai.knowledge.service.knowledge.KnowledgeBaseBuilder;
import com.flamingo.ai.knowledge.service.knowledge.KnowledgeBaseWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Builds a knowledge base from (document, source name) pairs.
 *
 * <pre>
 * build-knowledge regelwerk.docx regelwerk brandvoice.docx brandvoice out.json
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Command(
    name = "build-knowledge",
    description = "Chunk and index documents into a JSON knowledge base",
    mixinStandardHelpOptions = true)
public class BuildKnowledgeCommand implements Callable<Integer> {

  static final int MIN_PAIRS = 2;

  private final KnowledgeBaseBuilder knowledgeBaseBuilder;
  private final KnowledgeBaseWriter knowledgeBaseWriter;

  @Spec private CommandSpec spec;

  @Parameters(
      arity = "1..*",
      paramLabel = "ARG",
      description = "<doc1> <name1> <doc2> <name2> ... <out>: document/name pairs, then output")
  private List<String> arguments = new ArrayList<>();

  @Override
  public Integer call() {
    if (arguments.size() < MIN_PAIRS * 2 + 1 || (arguments.size() - 1) % 2 != 0) {
      throw new ParameterException(
          spec.commandLine(),
          "Usage: build-knowledge <doc1> <name1> <doc2> <name2> ... <out.json>");
    }

    Path out = Path.of(arguments.get(arguments.size() - 1));
    List<SourceDocument> documents = new ArrayList<>();
    for (int i = 0; i < arguments.size() - 1; i += 2) {
      documents.add(new SourceDocument(Path.of(arguments.get(i)), arguments.get(i + 1)));
    }

    log.info("Building knowledge base from {} documents into {}", documents.size(), out);
    KnowledgeBase knowledgeBase = knowledgeBaseBuilder.build(documents);
    knowledgeBaseWriter.write(knowledgeBase, out);

    spec.commandLine()
        .getOut()
        .printf("OK: wrote %s with %d chunks%n", out, knowledgeBase.chunkCount());
    return 0;
  }
}
