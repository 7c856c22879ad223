package com.flamingo.ai.specchunker.ingestion.model;

import java.util.List;

/**
 * Raw output of a page-content reader, before margin filtering and drawing clustering.
 *
 * @param pageNumber 1-indexed page number
 * @param width page width in points
 * @param height page height in points
 * @param textBlocks text blocks in reader order
 * @param drawingElements bounds of individual vector drawing elements
 * @param imageRegions placed raster images
 */
public record PageContent(
    int pageNumber,
    float width,
    float height,
    List<TextBlock> textBlocks,
    List<BoundingBox> drawingElements,
    List<ImageRegion> imageRegions) {

  public PageContent {
    textBlocks = List.copyOf(textBlocks);
    drawingElements = List.copyOf(drawingElements);
    imageRegions = List.copyOf(imageRegions);
  }
}
