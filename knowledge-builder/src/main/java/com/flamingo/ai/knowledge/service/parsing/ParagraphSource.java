package com.flamingo.ai.knowledge.service.parsing;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads a document into the ordered list of its paragraphs.
 *
 * <p>Every returned paragraph is stripped and non-empty. Implementations are format-specific and
 * stateless.
 */
public interface ParagraphSource {

  /**
   * Reads all paragraphs of the document in document order.
   *
   * @param path the document to read
   * @return stripped, non-empty paragraphs
   * @throws com.flamingo.ai.knowledge.exception.DocumentProcessingException if the document
   *     cannot be read
   */
  List<String> readParagraphs(Path path);

  /**
   * Returns {@code true} if this source can read the given file.
   *
   * @param path document path
   * @return {@code true} if supported
   */
  boolean supports(Path path);
}
