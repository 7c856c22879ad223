package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import java.util.List;

/**
 * A logical table that may still continue on the next page. {@code pending} is {@code null} when
 * nothing is buffered.
 */
public record TableBuilderState(Pending pending) {

  private static final TableBuilderState EMPTY = new TableBuilderState(null);

  public static TableBuilderState empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return pending == null;
  }

  /**
   * Rows collected so far for one logical table.
   *
   * @param header merged header
   * @param body data rows of every fragment, key carried forward
   * @param notes note lines of every fragment
   * @param section section of the first fragment
   * @param caption caption of the first fragment that had one
   * @param pageStart page of the first fragment
   * @param pageEnd page of the last fragment
   * @param lastBox bounds of the last fragment
   */
  public record Pending(
      List<String> header,
      List<List<String>> body,
      String notes,
      SectionNode section,
      String caption,
      int pageStart,
      int pageEnd,
      BoundingBox lastBox) {

    public Pending {
      header = List.copyOf(header);
      body = body.stream().map(List::copyOf).toList();
    }
  }
}
