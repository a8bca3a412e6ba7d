package com.flamingo.ai.knowledge.util;

import java.util.regex.Pattern;

/**
 * Whitespace handling over the Unicode {@code White_Space} property.
 *
 * <p>{@link String#strip()} stops at characters such as the no-break space (U+00A0) that word
 * processors put between a number and a heading; these helpers treat them as whitespace.
 */
public final class UnicodeWhitespace {

  private static final Pattern LEADING = Pattern.compile("^\\p{IsWhite_Space}+");
  private static final Pattern TRAILING = Pattern.compile("\\p{IsWhite_Space}+$");

  private UnicodeWhitespace() {}

  /** Removes leading and trailing Unicode whitespace. */
  public static String strip(String text) {
    String leading = LEADING.matcher(text).replaceFirst("");
    return TRAILING.matcher(leading).replaceFirst("");
  }
}
