package com.flamingo.ai.specchunker.ingestion.structure;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Recognises printed table-of-contents listings ("1.2 Scope ........ 14") on front-matter pages
 * whose TOC bookmark is missing or mislabelled.
 */
@Component
@RequiredArgsConstructor
public class TocPageDetector {

  private static final int MIN_LISTING_LINES = 2;

  private static final Pattern DOT_LEADER_LINE =
      Pattern.compile("^.*\\S\\s*(?:\\.\\s*){3,}\\d{1,4}\\s*$");

  private static final Pattern NUMBERED_ENTRY_LINE =
      Pattern.compile("^\\s*(?:\\d+(?:\\.\\d+)*|[A-Z](?:\\.\\d+)+)\\s+\\S.*\\s\\d{1,4}\\s*$");

  private final IngestionConfig config;

  public boolean isTocListing(List<TextBlock> blocks) {
    int lines = 0;
    int listingLines = 0;
    for (TextBlock block : blocks) {
      for (String line : block.text().split("\n")) {
        if (line.isBlank()) {
          continue;
        }
        lines++;
        if (isListingLine(line)) {
          listingLines++;
        }
      }
    }
    if (listingLines < MIN_LISTING_LINES) {
      return false;
    }
    return listingLines >= lines * config.getStructure().getTocListingLineRatio();
  }

  static boolean isListingLine(String line) {
    return DOT_LEADER_LINE.matcher(line).matches() || NUMBERED_ENTRY_LINE.matcher(line).matches();
  }
}
