package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.TableRegion;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rejects wide, sparse false-positive tables produced by decorative heading rules.
 *
 * <p>A region with at most {@code maxPlausibleColumns} columns is always kept. A wider region is
 * rejected when its first or last row holds a single populated cell, or when fewer than {@code
 * minWideTableFillRate} of its cells are populated.
 */
@Slf4j
@RequiredArgsConstructor
class TablePlausibilityFilter {

  private final IngestionConfig.Extraction settings;

  boolean isPlausible(TableRegion table) {
    List<List<String>> rows = table.rows();
    if (rows.isEmpty()) {
      return false;
    }
    int columns = table.columnCount();
    if (columns <= settings.getMaxPlausibleColumns()) {
      return true;
    }
    if (populated(rows.get(0)) == 1 || populated(rows.get(rows.size() - 1)) == 1) {
      log.debug("Rejected table with lone heading row: {} columns at {}", columns, table.bbox());
      return false;
    }
    int total = 0;
    int filled = 0;
    for (List<String> row : rows) {
      total += row.size();
      filled += populated(row);
    }
    double fillRate = total == 0 ? 0 : (double) filled / total;
    if (fillRate < settings.getMinWideTableFillRate()) {
      log.debug(
          "Rejected sparse table: {} columns, fill rate {} at {}",
          columns,
          String.format("%.2f", fillRate),
          table.bbox());
      return false;
    }
    return true;
  }

  private static int populated(List<String> row) {
    int count = 0;
    for (String cell : row) {
      if (cell != null && !cell.isBlank()) {
        count++;
      }
    }
    return count;
  }
}
