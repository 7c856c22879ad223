package com.flamingo.ai.specchunker.ingestion.model;

/**
 * An embedded raster image placed on a page.
 *
 * @param bbox placement on the page
 * @param pixelWidth image width in pixels (0 if unknown)
 * @param pixelHeight image height in pixels (0 if unknown)
 */
public record ImageRegion(BoundingBox bbox, int pixelWidth, int pixelHeight) {}
