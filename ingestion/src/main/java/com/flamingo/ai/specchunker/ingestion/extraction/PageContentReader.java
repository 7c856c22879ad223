package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.exception.PageExtractionException;
import com.flamingo.ai.specchunker.ingestion.model.PageContent;

/**
 * General page-content pass: text blocks with font hints, vector drawing elements and raster
 * images of a single page.
 *
 * <p>Implementations may be called from several threads, but never concurrently for the same
 * thread-confined resources.
 */
public interface PageContentReader {

  /**
   * Reads one page.
   *
   * @param pageNumber 1-indexed page number
   * @throws PageExtractionException if the page cannot be read
   */
  PageContent read(int pageNumber) throws PageExtractionException;
}
