package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Cleans extracted text: removes configured noise (watermarks, running titles), maps typographic
 * Unicode characters to ASCII equivalents and normalizes whitespace while keeping line breaks.
 */
@Component
public class TextNormalizer {

  private static final Map<String, String> CHAR_MAP = new LinkedHashMap<>();

  static {
    CHAR_MAP.put("\u00A0", " ");
    CHAR_MAP.put("\u2013", "-");
    CHAR_MAP.put("\u2014", "-");
    CHAR_MAP.put("\u2212", "-");
    CHAR_MAP.put("\u2018", "'");
    CHAR_MAP.put("\u2019", "'");
    CHAR_MAP.put("\u201C", "\"");
    CHAR_MAP.put("\u201D", "\"");
    CHAR_MAP.put("\u00B5", "u");
    CHAR_MAP.put("\u03BC", "u");
    CHAR_MAP.put("\u00B1", "+/-");
    CHAR_MAP.put("\u00B0", "deg");
    CHAR_MAP.put("\u2264", "<=");
    CHAR_MAP.put("\u2265", ">=");
    CHAR_MAP.put("\u00D7", "x");
    CHAR_MAP.put("\u2022", "*");
    CHAR_MAP.put("\u2026", "...");
    CHAR_MAP.put("\u2206", "Delta");
    CHAR_MAP.put("\uFB01", "fi");
    CHAR_MAP.put("\uFB02", "fl");
  }

  private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");
  private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" *\\n *");
  private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");
  private static final Pattern EMPTY_BRACKETS =
      Pattern.compile("\\(\\s*\\)|\\[\\s*]|\\(\\s*\\.\\s*\\)");

  private final List<Pattern> noisePatterns;

  public TextNormalizer(IngestionConfig config) {
    this.noisePatterns =
        config.getExtraction().getNoisePatterns().stream().map(Pattern::compile).toList();
  }

  /** Returns the cleaned text, or an empty string if nothing meaningful remains. */
  public String clean(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String result = text;
    for (Pattern noise : noisePatterns) {
      result = noise.matcher(result).replaceAll("");
    }
    for (Map.Entry<String, String> entry : CHAR_MAP.entrySet()) {
      result = result.replace(entry.getKey(), entry.getValue());
    }
    result = HORIZONTAL_SPACE.matcher(result).replaceAll(" ");
    result = SPACE_AROUND_NEWLINE.matcher(result).replaceAll("\n");
    result = EXCESS_NEWLINES.matcher(result).replaceAll("\n\n");
    result = EMPTY_BRACKETS.matcher(result).replaceAll("");
    return result.strip();
  }
}
