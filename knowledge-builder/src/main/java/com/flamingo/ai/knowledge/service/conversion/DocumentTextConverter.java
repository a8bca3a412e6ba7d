package com.flamingo.ai.knowledge.service.conversion;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.exception.DocumentProcessingException;
import com.flamingo.ai.knowledge.exception.NoInputDocumentsException;
import com.flamingo.ai.knowledge.exception.OutputWriteException;
import com.flamingo.ai.knowledge.service.chunking.ConversionHeadingClassifier;
import com.flamingo.ai.knowledge.service.parsing.ParagraphSourceRouter;
import com.flamingo.ai.knowledge.util.UnicodeWhitespace;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Converts documents to plain text with explicit heading separators.
 *
 * <p>Paragraphs are written one per line. Paragraphs accepted by the {@link
 * ConversionHeadingClassifier} are written as {@code === Heading ===} surrounded by blank lines.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentTextConverter {

  private final ParagraphSourceRouter sourceRouter;
  private final ConversionHeadingClassifier headingClassifier;
  private final KnowledgeConfig config;

  /**
   * Renders a single document as text.
   *
   * @param document document to convert
   * @return stripped text ending in exactly one newline
   */
  public String toText(Path document) {
    List<String> paragraphs = sourceRouter.route(document).readParagraphs(document);
    List<String> blocks = new ArrayList<>(paragraphs.size());
    for (String paragraph : paragraphs) {
      blocks.add(
          headingClassifier.isHeading(paragraph) ? "\n=== " + paragraph + " ===\n" : paragraph);
    }
    return UnicodeWhitespace.strip(String.join("\n", blocks)) + "\n";
  }

  /**
   * Converts every matching document of {@code inputDir} into {@code outputDir}.
   *
   * @param inputDir directory to scan (not recursive)
   * @param outputDir destination, created if missing
   * @return written files in input order
   * @throws NoInputDocumentsException if no file with the configured extension exists
   */
  public List<Path> convertDirectory(Path inputDir, Path outputDir) {
    Path in = inputDir.toAbsolutePath().normalize();
    Path out = outputDir.toAbsolutePath().normalize();
    try {
      Files.createDirectories(out);
    } catch (IOException e) {
      throw new OutputWriteException(out, e);
    }

    List<Path> documents = findDocuments(in);
    List<Path> written = new ArrayList<>(documents.size());
    for (Path document : documents) {
      String text = toText(document);
      Path target = out.resolve(targetFileName(document));
      try {
        Files.writeString(target, text, StandardCharsets.UTF_8);
      } catch (IOException e) {
        throw new OutputWriteException(target, e);
      }
      log.info("Converted {} to {}", document.getFileName(), target);
      written.add(target);
    }
    return written;
  }

  /** Source file name without its extension, spaces replaced by underscores, plus {@code .txt}. */
  static String targetFileName(Path document) {
    String name = document.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    return stem.replace(' ', '_') + ".txt";
  }

  private List<Path> findDocuments(Path directory) {
    String extension = config.getConversion().getExtension();
    if (!Files.isDirectory(directory)) {
      throw new NoInputDocumentsException(directory, extension);
    }
    List<Path> documents;
    try (Stream<Path> entries = Files.list(directory)) {
      documents =
          entries
              .filter(Files::isRegularFile)
              .filter(p -> p.getFileName().toString().endsWith(extension))
              .sorted(Comparator.comparing(p -> p.getFileName().toString()))
              .collect(Collectors.toList());
    } catch (IOException e) {
      throw new DocumentProcessingException(
          directory.toString(), "Failed to list input directory: " + e.getMessage(), e);
    }
    if (documents.isEmpty()) {
      throw new NoInputDocumentsException(directory, extension);
    }
    return documents;
  }
}
