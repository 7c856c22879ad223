package com.flamingo.ai.specchunker.ingestion.classify;

import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import java.util.List;

/**
 * Classified content of one page.
 *
 * @param pageNumber 1-indexed page number
 * @param section section the page was classified under, or {@code null} before the first section
 * @param items page elements in reading order; suppressed blocks are absent
 * @param textBlocks every text block of the page, for caption lookups
 * @param lowConfidenceCount number of placement decisions made inside a tolerance band
 */
public record PageClassification(
    int pageNumber,
    SectionNode section,
    List<ClassifiedItem> items,
    List<TextBlock> textBlocks,
    int lowConfidenceCount) {

  public PageClassification {
    items = List.copyOf(items);
    textBlocks = List.copyOf(textBlocks);
  }
}
