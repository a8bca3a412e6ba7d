package com.flamingo.ai.knowledge.service.chunking;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Looser heading rules used when converting documents to plain text.
 *
 * <p>Accepts any line of at most {@code knowledge.conversion.max-heading-length} characters that is
 * fully uppercase, starts with a digit in each of its first two positions, or starts with one of
 * the configured literal prefixes.
 */
@Component
public class ConversionHeadingClassifier implements HeadingClassifier {

  private final int maxLength;
  private final List<String> prefixes;

  public ConversionHeadingClassifier(KnowledgeConfig config) {
    this.maxLength = config.getConversion().getMaxHeadingLength();
    this.prefixes = List.copyOf(config.getConversion().getHeadingPrefixes());
  }

  @Override
  public boolean isHeading(String line) {
    if (line.isEmpty() || HeadingClassifier.length(line) > maxLength) {
      return false;
    }
    return isUpperCase(line)
        || startsWithDigits(line)
        || prefixes.stream().anyMatch(line::startsWith);
  }

  /** At least one cased character and none of them lower- or titlecase. */
  static boolean isUpperCase(String line) {
    boolean cased = false;
    for (int i = 0; i < line.length(); ) {
      int cp = line.codePointAt(i);
      if (Character.isLowerCase(cp) || Character.isTitleCase(cp)) {
        return false;
      }
      if (Character.isUpperCase(cp)) {
        cased = true;
      }
      i += Character.charCount(cp);
    }
    return cased;
  }

  private static boolean startsWithDigits(String line) {
    int first = line.codePointAt(0);
    if (!Character.isDigit(first)) {
      return false;
    }
    int next = Character.charCount(first);
    return next >= line.length() || Character.isDigit(line.codePointAt(next));
  }
}
