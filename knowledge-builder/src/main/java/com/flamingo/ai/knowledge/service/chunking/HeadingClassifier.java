package com.flamingo.ai.knowledge.service.chunking;

/**
 * Decides whether a single line of text is a section heading.
 *
 * <p>Implementations are stateless. Two rule sets exist and must not be mixed: {@link
 * SectionHeadingClassifier} bounds chunks, {@link ConversionHeadingClassifier} marks headings in
 * converted text.
 */
public interface HeadingClassifier {

  /**
   * Classifies one stripped line.
   *
   * @param line the line to test
   * @return {@code true} if the line is a heading
   */
  boolean isHeading(String line);

  /** Length of a string in Unicode code points. */
  static int length(String text) {
    return text.codePointCount(0, text.length());
  }
}
