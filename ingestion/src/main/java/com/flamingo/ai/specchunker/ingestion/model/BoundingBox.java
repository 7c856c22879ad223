package com.flamingo.ai.specchunker.ingestion.model;

import java.util.Collection;

/**
 * Axis-aligned box in page coordinates: origin at the top-left corner, y grows downward, units are
 * PDF points.
 *
 * @param x0 left edge
 * @param y0 top edge
 * @param x1 right edge
 * @param y1 bottom edge
 */
public record BoundingBox(float x0, float y0, float x1, float y1) {

  public BoundingBox {
    if (x1 < x0) {
      float t = x0;
      x0 = x1;
      x1 = t;
    }
    if (y1 < y0) {
      float t = y0;
      y0 = y1;
      y1 = t;
    }
  }

  public float width() {
    return x1 - x0;
  }

  public float height() {
    return y1 - y0;
  }

  public float area() {
    return width() * height();
  }

  public float centerX() {
    return (x0 + x1) / 2f;
  }

  public float centerY() {
    return (y0 + y1) / 2f;
  }

  /** Returns {@code true} if the point lies inside this box grown by {@code tolerance}. */
  public boolean contains(float x, float y, float tolerance) {
    return x >= x0 - tolerance && x <= x1 + tolerance && y >= y0 - tolerance && y <= y1 + tolerance;
  }

  /** Returns {@code true} if the center of {@code other} lies inside this box ± tolerance. */
  public boolean containsCenterOf(BoundingBox other, float tolerance) {
    return contains(other.centerX(), other.centerY(), tolerance);
  }

  /** Returns {@code true} if the boxes overlap or are closer than {@code padding} on both axes. */
  public boolean isNear(BoundingBox other, float padding) {
    return x0 - padding < other.x1
        && x1 + padding > other.x0
        && y0 - padding < other.y1
        && y1 + padding > other.y0;
  }

  /** Vertical gap to {@code other}; negative when the two boxes overlap vertically. */
  public float verticalGap(BoundingBox other) {
    if (y1 <= other.y0) {
      return other.y0 - y1;
    }
    if (other.y1 <= y0) {
      return y0 - other.y1;
    }
    return -1f;
  }

  public BoundingBox union(BoundingBox other) {
    return new BoundingBox(
        Math.min(x0, other.x0),
        Math.min(y0, other.y0),
        Math.max(x1, other.x1),
        Math.max(y1, other.y1));
  }

  /** Smallest box containing every box in {@code boxes}. */
  public static BoundingBox enclosing(Collection<BoundingBox> boxes) {
    BoundingBox result = null;
    for (BoundingBox box : boxes) {
      result = result == null ? box : result.union(box);
    }
    if (result == null) {
      throw new IllegalArgumentException("No boxes to enclose");
    }
    return result;
  }
}
