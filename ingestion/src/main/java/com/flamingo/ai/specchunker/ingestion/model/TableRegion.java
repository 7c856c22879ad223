package com.flamingo.ai.specchunker.ingestion.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A candidate table reported by the table-geometry reader.
 *
 * @param bbox region bounds
 * @param rows cell text per row; {@code null} marks an empty or spanned cell, {@code \n} marks an
 *     in-cell line break
 * @param headerRowHint number of leading rows the reader believes form the header (at least 1)
 */
public record TableRegion(BoundingBox bbox, List<List<String>> rows, int headerRowHint) {

  public TableRegion {
    List<List<String>> copy = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    rows = Collections.unmodifiableList(copy);
    headerRowHint = Math.max(1, headerRowHint);
  }

  public TableRegion(BoundingBox bbox, List<List<String>> rows) {
    this(bbox, rows, 1);
  }

  public int columnCount() {
    int max = 0;
    for (List<String> row : rows) {
      max = Math.max(max, row.size());
    }
    return max;
  }

  /** All non-blank cell text in reading order, one row per line. */
  public String plainText() {
    StringBuilder sb = new StringBuilder();
    for (List<String> row : rows) {
      StringBuilder line = new StringBuilder();
      for (String cell : row) {
        if (cell != null && !cell.isBlank()) {
          if (line.length() > 0) {
            line.append(' ');
          }
          line.append(cell.replace('\n', ' ').trim());
        }
      }
      if (line.length() > 0) {
        sb.append(line).append('\n');
      }
    }
    return sb.toString().trim();
  }
}
