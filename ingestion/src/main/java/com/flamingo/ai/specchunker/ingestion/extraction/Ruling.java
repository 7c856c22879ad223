package com.flamingo.ai.specchunker.ingestion.extraction;

/**
 * A straight stroked segment on a page, top-left origin. Horizontal and vertical rulings form table
 * grids.
 */
record Ruling(float x0, float y0, float x1, float y1) {

  Ruling {
    if (x1 < x0 || (x1 == x0 && y1 < y0)) {
      float tx = x0;
      float ty = y0;
      x0 = x1;
      y0 = y1;
      x1 = tx;
      y1 = ty;
    }
  }

  boolean isHorizontal(float tolerance) {
    return Math.abs(y1 - y0) <= tolerance && length() > 0;
  }

  boolean isVertical(float tolerance) {
    return Math.abs(x1 - x0) <= tolerance && length() > 0;
  }

  float length() {
    return (float) Math.hypot(x1 - x0, y1 - y0);
  }

  float top() {
    return Math.min(y0, y1);
  }

  float bottom() {
    return Math.max(y0, y1);
  }

  float y() {
    return (y0 + y1) / 2f;
  }

  float x() {
    return (x0 + x1) / 2f;
  }
}
