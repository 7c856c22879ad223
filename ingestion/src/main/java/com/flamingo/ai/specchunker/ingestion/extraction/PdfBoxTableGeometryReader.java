package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.exception.PageExtractionException;
import com.flamingo.ai.specchunker.ingestion.model.TableRegion;
import java.io.IOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;

/** {@link TableGeometryReader} that finds ruled tables from a page's stroked lines. */
@Slf4j
class PdfBoxTableGeometryReader implements TableGeometryReader {

  private final PdfDocumentHandles handles;
  private final TableGridBuilder gridBuilder;
  private final TablePlausibilityFilter plausibilityFilter;

  PdfBoxTableGeometryReader(PdfDocumentHandles handles, IngestionConfig config) {
    IngestionConfig.Extraction settings = config.getExtraction();
    this.handles = handles;
    this.gridBuilder =
        new TableGridBuilder(settings.getRulingSnapTolerance(), settings.getMinRulingLength());
    this.plausibilityFilter = new TablePlausibilityFilter(settings);
  }

  @Override
  public List<TableRegion> read(int pageNumber) throws PageExtractionException {
    try {
      PDDocument document = handles.current();
      PDPage page = document.getPage(pageNumber - 1);

      PdfGraphicsCollector graphics = new PdfGraphicsCollector(page);
      graphics.run();
      if (graphics.rulings().isEmpty()) {
        return List.of();
      }
      List<Glyph> glyphs = new GlyphCollector().collect(document, pageNumber);
      List<TableRegion> tables =
          gridBuilder.build(graphics.rulings(), glyphs).stream()
              .filter(plausibilityFilter::isPlausible)
              .toList();
      log.debug("Page {}: {} table region(s)", pageNumber, tables.size());
      return tables;
    } catch (IOException | RuntimeException e) {
      throw new PageExtractionException(
          pageNumber, "Failed to detect tables: " + e.getMessage(), e);
    }
  }
}
