package com.flamingo.ai.specchunker.ingestion.model;

import java.util.List;

/**
 * Normalized content of one physical page. Immutable once produced.
 *
 * @param pageNumber 1-indexed page number
 * @param width page width in points
 * @param height page height in points
 * @param textBlocks text blocks from the general page-content pass
 * @param tableRegions candidate tables from the table-geometry pass
 * @param drawingRegions clustered vector drawings
 * @param imageRegions raster images
 */
public record PageModel(
    int pageNumber,
    float width,
    float height,
    List<TextBlock> textBlocks,
    List<TableRegion> tableRegions,
    List<DrawingRegion> drawingRegions,
    List<ImageRegion> imageRegions) {

  public PageModel {
    textBlocks = List.copyOf(textBlocks);
    tableRegions = List.copyOf(tableRegions);
    drawingRegions = List.copyOf(drawingRegions);
    imageRegions = List.copyOf(imageRegions);
  }
}
