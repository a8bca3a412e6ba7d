package com.flamingo.ai.knowledge.service.chunking;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Heading rules used by the chunker.
 *
 * <p>A line is a heading only if it is at most {@code knowledge.headings.max-length} characters
 * long and starts with one of:
 *
 * <ul>
 *   <li>a part marker followed by a single capital, e.g. {@code TEIL A}, {@code PART B}
 *   <li>a numbered step, e.g. {@code 4. Schritt}, {@code 2. Step}
 *   <li>a numbered list marker, e.g. {@code 12. }
 *   <li>an emphasized run of capitals, digits, spaces, {@code -}, {@code _} or {@code /}, e.g.
 *       {@code ÜBERSICHT DER REGELN}
 *   <li>a bracket tag, e.g. {@code <Beispiel>}
 * </ul>
 *
 * <p>Capitals are matched with {@code \p{Lu}}, so accented uppercase letters count, and {@code \s}
 * matches any Unicode whitespace, including the no-break space.
 */
@Component
@Primary
public class SectionHeadingClassifier implements HeadingClassifier {

  private final int maxLength;
  private final Pattern pattern;

  public SectionHeadingClassifier(KnowledgeConfig config) {
    KnowledgeConfig.Headings headings = config.getHeadings();
    this.maxLength = headings.getMaxLength();
    this.pattern = compile(headings);
  }

  @Override
  public boolean isHeading(String line) {
    return HeadingClassifier.length(line) <= maxLength && pattern.matcher(line).lookingAt();
  }

  private static Pattern compile(KnowledgeConfig.Headings headings) {
    List<String> alternatives = new ArrayList<>();
    if (!headings.getPartMarkers().isEmpty()) {
      alternatives.add("(?:" + quoteAll(headings.getPartMarkers()) + ")\\s+\\p{Lu}");
    }
    if (!headings.getStepWords().isEmpty()) {
      alternatives.add("[0-9]+\\.\\s+(?:" + quoteAll(headings.getStepWords()) + ")");
    }
    alternatives.add("[0-9]+\\.\\s+");
    alternatives.add(
        "[\\p{Lu}0-9][\\p{Lu}0-9 \\-_/]{" + (headings.getEmphasisMinLength() - 1) + ",}");
    alternatives.add("<[^>]+>");
    return Pattern.compile(
        "(?:" + String.join("|", alternatives) + ")", Pattern.UNICODE_CHARACTER_CLASS);
  }

  private static String quoteAll(List<String> words) {
    return words.stream().map(Pattern::quote).collect(Collectors.joining("|"));
  }
}
