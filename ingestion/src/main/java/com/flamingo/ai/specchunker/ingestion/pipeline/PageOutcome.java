package com.flamingo.ai.specchunker.ingestion.pipeline;

import com.flamingo.ai.specchunker.ingestion.classify.PageClassification;
import com.flamingo.ai.specchunker.ingestion.model.PageGap;

/**
 * Result of extracting and classifying one page: either a classification or a gap.
 *
 * @param pageNumber 1-indexed page number
 * @param classification classified page, or {@code null} for a gap
 * @param gap reason the page was skipped, or {@code null}
 */
public record PageOutcome(int pageNumber, PageClassification classification, PageGap gap) {

  public static PageOutcome processed(PageClassification classification) {
    return new PageOutcome(classification.pageNumber(), classification, null);
  }

  public static PageOutcome skipped(int pageNumber, String reason) {
    return new PageOutcome(pageNumber, null, new PageGap(pageNumber, reason));
  }

  public boolean isGap() {
    return gap != null;
  }
}
