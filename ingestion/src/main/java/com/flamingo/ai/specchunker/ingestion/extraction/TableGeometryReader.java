package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.exception.PageExtractionException;
import com.flamingo.ai.specchunker.ingestion.model.TableRegion;
import java.util.List;

/** Table-geometry pass: candidate table regions with cell text for a single page. */
public interface TableGeometryReader {

  /**
   * Detects tables on one page.
   *
   * @param pageNumber 1-indexed page number
   * @return candidate regions ordered top to bottom, possibly empty
   * @throws PageExtractionException if the page cannot be read
   */
  List<TableRegion> read(int pageNumber) throws PageExtractionException;
}
