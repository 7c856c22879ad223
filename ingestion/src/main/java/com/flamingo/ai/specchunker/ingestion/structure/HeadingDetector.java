package com.flamingo.ai.specchunker.ingestion.structure;

import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Recognises section headings inside page text.
 *
 * <p>Matching order:
 *
 * <ol>
 *   <li>the whole block equals a TOC label;
 *   <li>the block starts with a TOC label followed by whitespace (heading merged with the first
 *       paragraph), longest label first;
 *   <li>the first line is a short numbered heading whose number is in the TOC;
 *   <li>the first line is a short numbered heading set in a bold font.
 * </ol>
 */
@Component
public class HeadingDetector {

  private static final int MAX_HEADING_LINE = 120;

  private static final Pattern NUMBERED_HEADING =
      Pattern.compile("^(\\d+(?:\\.\\d+)+|\\d+)\\.?\\s+([A-Z][^\\n]{1,118})$");

  public Optional<HeadingMatch> detect(TextBlock block, DocumentStructure structure) {
    String text = block.text();
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String normalized = DocumentStructure.normalizeLabel(text);
    String firstLine = firstLine(text);

    SectionNode exact = structure.getLabelToSection().get(normalized);
    if (exact != null) {
      return Optional.of(new HeadingMatch(exact.getLevel(), exact, firstLine));
    }

    SectionNode prefixed = longestPrefixLabel(normalized, structure.getLabelToSection());
    if (prefixed != null) {
      return Optional.of(new HeadingMatch(prefixed.getLevel(), prefixed, firstLine));
    }

    if (firstLine.length() > MAX_HEADING_LINE) {
      return Optional.empty();
    }
    Matcher m = NUMBERED_HEADING.matcher(firstLine);
    if (!m.matches()) {
      return Optional.empty();
    }
    String number = m.group(1);
    Optional<SectionNode> byNumber = structure.findByNumber(number);
    if (byNumber.isPresent()) {
      return Optional.of(new HeadingMatch(byNumber.get().getLevel(), byNumber.get(), firstLine));
    }
    if (block.bold() && number.contains(".")) {
      return Optional.of(new HeadingMatch(number.split("\\.").length, null, firstLine));
    }
    return Optional.empty();
  }

  private SectionNode longestPrefixLabel(String normalized, Map<String, SectionNode> labels) {
    SectionNode best = null;
    int bestLength = 0;
    for (Map.Entry<String, SectionNode> entry : labels.entrySet()) {
      String label = entry.getKey();
      if (label.length() > bestLength
          && normalized.length() > label.length()
          && normalized.startsWith(label)
          && Character.isWhitespace(normalized.charAt(label.length()))) {
        best = entry.getValue();
        bestLength = label.length();
      }
    }
    return best;
  }

  private static String firstLine(String text) {
    String stripped = text.strip();
    int newline = stripped.indexOf('\n');
    return newline < 0 ? stripped : stripped.substring(0, newline).strip();
  }
}
