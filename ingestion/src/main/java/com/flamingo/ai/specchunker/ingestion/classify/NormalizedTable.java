package com.flamingo.ai.specchunker.ingestion.classify;

import java.util.List;

/**
 * A table region after header merging, note extraction and key carry-forward.
 *
 * @param header one merged header cell per column
 * @param body data rows, each padded to the column count
 * @param notes trailing note text, one note per line; empty if none
 */
public record NormalizedTable(List<String> header, List<List<String>> body, String notes) {

  public NormalizedTable {
    header = List.copyOf(header);
    body = body.stream().map(List::copyOf).toList();
    notes = notes == null ? "" : notes;
  }

  public int columnCount() {
    return header.size();
  }

  /** Returns {@code true} when the region has columns and at least one data row. */
  public boolean isStructured() {
    return columnCount() > 0 && !body.isEmpty();
  }

  public boolean hasNotes() {
    return !notes.isEmpty();
  }
}
