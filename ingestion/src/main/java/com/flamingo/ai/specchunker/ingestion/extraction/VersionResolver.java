package com.flamingo.ai.specchunker.ingestion.extraction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Derives a document's version tag from its file name. */
public final class VersionResolver {

  static final String UNKNOWN = "unknown";

  /** Edition suffix such as "B51" in "JESD84-B51" (version 5.1). */
  private static final Pattern EDITION = Pattern.compile("(?i)(?<![A-Za-z])B(\\d)(\\d+)");

  private static final Pattern DOTTED = Pattern.compile("(?i)(?<![A-Za-z])v?(\\d+)\\.(\\d+)");

  private VersionResolver() {}

  /**
   * Returns {@code configured} when it is set, otherwise the version encoded in {@code fileName},
   * otherwise {@code "unknown"}.
   */
  public static String resolve(String configured, String fileName) {
    if (configured != null && !configured.isBlank()) {
      return configured.strip();
    }
    if (fileName == null) {
      return UNKNOWN;
    }
    Matcher edition = EDITION.matcher(fileName);
    if (edition.find()) {
      return edition.group(1) + "." + edition.group(2);
    }
    Matcher dotted = DOTTED.matcher(fileName);
    if (dotted.find()) {
      return dotted.group(1) + "." + dotted.group(2);
    }
    return UNKNOWN;
  }
}
