package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.exception.PageExtractionException;
import com.flamingo.ai.specchunker.ingestion.model.PageContent;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

/** {@link PageContentReader} backed by PDFBox text stripping and graphics stream parsing. */
@Slf4j
@RequiredArgsConstructor
class PdfBoxPageContentReader implements PageContentReader {

  private final PdfDocumentHandles handles;

  @Override
  public PageContent read(int pageNumber) throws PageExtractionException {
    try {
      PDDocument document = handles.current();
      PDPage page = document.getPage(pageNumber - 1);
      PDRectangle box = page.getCropBox();

      List<Glyph> glyphs = new GlyphCollector().collect(document, pageNumber);
      List<TextBlock> blocks = TextLayout.blocks(TextLayout.lines(glyphs, true));

      PdfGraphicsCollector graphics = new PdfGraphicsCollector(page);
      graphics.run();

      log.debug(
          "Page {}: {} text blocks, {} drawing elements, {} images",
          pageNumber,
          blocks.size(),
          graphics.drawingElements().size(),
          graphics.images().size());
      return new PageContent(
          pageNumber,
          box.getWidth(),
          box.getHeight(),
          blocks,
          graphics.drawingElements(),
          graphics.images());
    } catch (IOException | RuntimeException e) {
      throw new PageExtractionException(
          pageNumber, "Failed to read page content: " + e.getMessage(), e);
    }
  }
}
