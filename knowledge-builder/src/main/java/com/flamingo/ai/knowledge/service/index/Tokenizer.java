package com.flamingo.ai.knowledge.service.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Extracts lowercase word tokens from text.
 *
 * <p>A token is a maximal run of Unicode letters and decimal digits ({@code \p{L}}, {@code \p{Nd}})
 * so German umlauts and {@code ß} stay inside words. Combining marks continue a run, which keeps
 * decomposed characters and the output of {@link String#toLowerCase} in one token. No stemming, no
 * stop words and no length filter.
 */
@Component
public class Tokenizer {

  private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{Nd}][\\p{L}\\p{M}\\p{Nd}]*");

  public List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return tokens;
    }
    Matcher matcher = TOKEN.matcher(text);
    while (matcher.find()) {
      tokens.add(matcher.group().toLowerCase(Locale.ROOT));
    }
    return tokens;
  }
}
