package com.flamingo.ai.specchunker.ingestion.model;

/**
 * A cluster of vector drawing elements (a diagram candidate).
 *
 * @param bbox bounds of the whole cluster
 * @param elementCount number of drawing elements merged into the cluster
 */
public record DrawingRegion(BoundingBox bbox, int elementCount) {

  public float area() {
    return bbox.area();
  }
}
