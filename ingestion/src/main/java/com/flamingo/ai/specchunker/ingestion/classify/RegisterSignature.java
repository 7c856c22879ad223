package com.flamingo.ai.specchunker.ingestion.classify;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises bit-field register descriptions: a bracketed bit range such as {@code [7]} or {@code
 * [9:8]} together with at least two field markers. Markers are enumerated value entries ({@code
 * 0h:}, {@code 01b =}) and register access keywords ({@code R/W}, {@code Reserved}), so a single
 * sentence mentioning one reserved bit range stays prose.
 */
public final class RegisterSignature {

  public static final Pattern BIT_RANGE = Pattern.compile("\\[\\d+(?::\\d+)?]");

  private static final Pattern VALUE_ENTRY =
      Pattern.compile("(?:^|\\s)(?:0x[0-9A-Fa-f]+|[01]+b|[0-9A-Fa-f]+h)\\s*[:=]");

  private static final Pattern ACCESS_KEYWORD =
      Pattern.compile(
          "(?<![\\w/])(?:r/w/e_p|r/w/c_p|r/w/e|r/wp|r/w|otp|reserved|read/write|read only"
              + "|write once)(?![\\w/])",
          Pattern.CASE_INSENSITIVE);

  private static final int MIN_FIELD_MARKERS = 2;

  private RegisterSignature() {}

  public static boolean matches(String text) {
    if (text == null || !BIT_RANGE.matcher(text).find()) {
      return false;
    }
    int markers = count(ACCESS_KEYWORD.matcher(text)) + count(VALUE_ENTRY.matcher(text));
    return markers >= MIN_FIELD_MARKERS;
  }

  private static int count(Matcher matcher) {
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
