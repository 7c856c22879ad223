package com.flamingo.ai.specchunker.ingestion.model;

/**
 * A unit of text produced by the page-content reader.
 *
 * @param bbox block bounds
 * @param text cleaned text; lines of the block are separated by {@code \n}
 * @param fontSize average font size in points (0 if unknown)
 * @param bold whether the dominant font is bold (heading hint)
 * @param blockNumber position of the block in the reader's output for its page
 */
public record TextBlock(
    BoundingBox bbox, String text, float fontSize, boolean bold, int blockNumber) {

  /** Block without font hints. */
  public static TextBlock of(BoundingBox bbox, String text) {
    return new TextBlock(bbox, text, 0f, false, 0);
  }

  public TextBlock withText(String newText) {
    return new TextBlock(bbox, newText, fontSize, bold, blockNumber);
  }
}
