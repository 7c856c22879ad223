package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.exception.PageExtractionException;
import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.ImageRegion;
import com.flamingo.ai.specchunker.ingestion.model.PageContent;
import com.flamingo.ai.specchunker.ingestion.model.PageModel;
import com.flamingo.ai.specchunker.ingestion.model.TableRegion;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Produces the normalized {@link PageModel} of a page from a document's two readers.
 *
 * <p>Running headers and footers (blocks entirely inside the top or bottom margin band) are
 * dropped, text is cleaned, vector drawing elements are clustered into regions. A failing
 * table-geometry pass degrades to a page without tables; a failing content pass fails the page.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageExtractor {

  /** Single-character cells produced by glyph artefacts in ruled tables. */
  private static final String CELL_NOISE = "i";

  private final IngestionConfig config;
  private final TextNormalizer normalizer;
  private final DrawingClusterer drawingClusterer;

  public PageModel extract(DocumentSource source, int pageNumber) throws PageExtractionException {
    PageContent content = source.pageContentReader().read(pageNumber);

    List<TableRegion> rawTables;
    try {
      rawTables = source.tableGeometryReader().read(pageNumber);
    } catch (PageExtractionException e) {
      log.warn(
          "Table detection failed on page {} of {}, continuing without tables: {}",
          pageNumber,
          source.sourceId(),
          e.getMessage());
      rawTables = List.of();
    }

    float height = content.height();
    List<TextBlock> blocks = new ArrayList<>();
    for (TextBlock block : content.textBlocks()) {
      if (inMargin(block.bbox(), height)) {
        continue;
      }
      String text = normalizer.clean(block.text());
      if (!text.isEmpty()) {
        blocks.add(block.withText(text));
      }
    }

    List<TableRegion> tables = new ArrayList<>();
    for (TableRegion table : rawTables) {
      TableRegion cleaned = cleanTable(table);
      if (cleaned != null) {
        tables.add(cleaned);
      }
    }

    List<BoundingBox> drawingElements =
        content.drawingElements().stream().filter(box -> !inMargin(box, height)).toList();
    List<ImageRegion> images =
        content.imageRegions().stream().filter(image -> !inMargin(image.bbox(), height)).toList();

    return new PageModel(
        pageNumber,
        content.width(),
        height,
        blocks,
        tables,
        drawingClusterer.cluster(drawingElements),
        images);
  }

  private boolean inMargin(BoundingBox box, float pageHeight) {
    IngestionConfig.Extraction settings = config.getExtraction();
    return box.y1() < settings.getHeaderMargin()
        || box.y0() > pageHeight - settings.getFooterMargin();
  }

  private TableRegion cleanTable(TableRegion table) {
    List<List<String>> rows = new ArrayList<>();
    for (List<String> row : table.rows()) {
      List<String> cleaned = new ArrayList<>(row.size());
      boolean any = false;
      for (String cell : row) {
        String text = cell == null ? "" : normalizer.clean(cell);
        if (text.isEmpty() || text.equals(CELL_NOISE)) {
          cleaned.add(null);
        } else {
          cleaned.add(text);
          any = true;
        }
      }
      if (any) {
        rows.add(cleaned);
      }
    }
    return rows.isEmpty() ? null : new TableRegion(table.bbox(), rows, table.headerRowHint());
  }
}
