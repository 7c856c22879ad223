package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;

/**
 * A single positioned character (or ligature) from a page's text layer.
 *
 * @param bbox glyph bounds, top-left origin; {@code y1} is the baseline
 * @param text unicode text of the glyph
 * @param fontSize font size in points
 * @param spaceWidth width of a space in the glyph's font
 * @param bold whether the font is bold
 */
record Glyph(BoundingBox bbox, String text, float fontSize, float spaceWidth, boolean bold) {

  float effectiveSpaceWidth() {
    if (spaceWidth > 0 && !Float.isNaN(spaceWidth)) {
      return spaceWidth;
    }
    return Math.max(1f, fontSize * 0.25f);
  }
}
