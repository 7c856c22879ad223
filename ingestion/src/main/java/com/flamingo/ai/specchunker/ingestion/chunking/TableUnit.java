package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.ingestion.classify.NormalizedTable;
import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import java.util.ArrayList;
import java.util.List;

/**
 * One accepted table handed to the {@link TableChunker}.
 *
 * @param bbox table bounds, used for the continuation edge check
 * @param table normalized cells
 * @param page page the table is on
 * @param section section the table belongs to
 * @param caption {@code Table N - ...} caption, or empty
 * @param firstOnPage whether no other table precedes it on the page
 * @param lastOnPage whether no other table follows it on the page
 * @param rows raw cell rows as read from the page, re-read without a header zone when the table
 *     continues an earlier fragment
 */
public record TableUnit(
    BoundingBox bbox,
    NormalizedTable table,
    int page,
    SectionNode section,
    String caption,
    boolean firstOnPage,
    boolean lastOnPage,
    List<List<String>> rows) {

  public TableUnit {
    caption = caption == null ? "" : caption;
    rows = rows == null ? headerAndBody(table) : rows;
  }

  public TableUnit(
      BoundingBox bbox,
      NormalizedTable table,
      int page,
      SectionNode section,
      String caption,
      boolean firstOnPage,
      boolean lastOnPage) {
    this(bbox, table, page, section, caption, firstOnPage, lastOnPage, null);
  }

  private static List<List<String>> headerAndBody(NormalizedTable table) {
    List<List<String>> rows = new ArrayList<>(table.body().size() + 1);
    rows.add(table.header());
    rows.addAll(table.body());
    return rows;
  }
}
