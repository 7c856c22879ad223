package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

/**
 * Collects the positioned glyphs of one page in reading order.
 *
 * <p>Coordinates are taken from the direction-adjusted text positions, so they share the top-left
 * origin of the cropped page.
 */
final class GlyphCollector extends PDFTextStripper {

  private static final float BOLD_WEIGHT = 700f;

  private final List<Glyph> glyphs = new ArrayList<>();

  GlyphCollector() throws IOException {
    super();
    setSortByPosition(true);
  }

  /** Runs the stripper over a single page and returns its glyphs. */
  List<Glyph> collect(PDDocument document, int pageNumber) throws IOException {
    glyphs.clear();
    setStartPage(pageNumber);
    setEndPage(pageNumber);
    getText(document);
    return List.copyOf(glyphs);
  }

  @Override
  protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
    for (TextPosition pos : textPositions) {
      String unicode = pos.getUnicode();
      if (unicode == null || unicode.isEmpty()) {
        continue;
      }
      float x = pos.getXDirAdj();
      float baseline = pos.getYDirAdj();
      float top = baseline - Math.max(pos.getHeightDir(), 1f);
      glyphs.add(
          new Glyph(
              new BoundingBox(x, top, x + Math.max(pos.getWidthDirAdj(), 0.1f), baseline),
              unicode,
              pos.getFontSizeInPt(),
              pos.getWidthOfSpace(),
              isBold(pos.getFont())));
    }
  }

  private static boolean isBold(PDFont font) {
    if (font == null) {
      return false;
    }
    String name = font.getName();
    if (name != null && name.toLowerCase(Locale.ROOT).contains("bold")) {
      return true;
    }
    PDFontDescriptor descriptor = font.getFontDescriptor();
    return descriptor != null
        && (descriptor.isForceBold() || descriptor.getFontWeight() >= BOLD_WEIGHT);
  }
}
