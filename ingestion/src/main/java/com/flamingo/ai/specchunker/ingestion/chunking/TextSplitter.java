package com.flamingo.ai.specchunker.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Size estimation and boundary-preserving splitting of prose. */
final class TextSplitter {

  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\n");

  private TextSplitter() {}

  static int estimateTokens(String text, int charsPerToken) {
    return text.length() / Math.max(1, charsPerToken);
  }

  /**
   * Packs whole sentences (or lines) into pieces of at most {@code maxChars}. A single sentence
   * longer than the limit is cut at the last whitespace before the limit. No text is dropped.
   */
  static List<String> splitAtSentences(String text, int maxChars) {
    List<String> pieces = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String sentence : SENTENCE_BOUNDARY.split(text)) {
      String trimmed = sentence.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      if (trimmed.length() > maxChars) {
        flush(pieces, current);
        pieces.addAll(splitByCharLimit(trimmed, maxChars));
        continue;
      }
      if (current.length() > 0 && current.length() + 1 + trimmed.length() > maxChars) {
        flush(pieces, current);
      }
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(trimmed);
    }
    flush(pieces, current);
    return pieces;
  }

  static List<String> splitByCharLimit(String text, int maxChars) {
    List<String> pieces = new ArrayList<>();
    int start = 0;
    while (start < text.length()) {
      int end = Math.min(text.length(), start + maxChars);
      if (end < text.length()) {
        int space = text.lastIndexOf(' ', end);
        if (space > start) {
          end = space;
        }
      }
      String piece = text.substring(start, end).strip();
      if (!piece.isEmpty()) {
        pieces.add(piece);
      }
      start = end;
    }
    return pieces;
  }

  private static void flush(List<String> pieces, StringBuilder current) {
    if (current.length() > 0) {
      pieces.add(current.toString());
      current.setLength(0);
    }
  }
}
