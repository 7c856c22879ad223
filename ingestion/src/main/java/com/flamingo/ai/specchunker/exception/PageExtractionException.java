package com.flamingo.ai.specchunker.exception;

/**
 * Thrown by an extraction capability when a single page cannot be read.
 *
 * <p>The pipeline catches it per page, skips the page and records a gap.
 */
public class PageExtractionException extends Exception {

  private final int pageNumber;

  public PageExtractionException(int pageNumber, String message) {
    super(message);
    this.pageNumber = pageNumber;
  }

  public PageExtractionException(int pageNumber, String message, Throwable cause) {
    super(message, cause);
    this.pageNumber = pageNumber;
  }

  public int getPageNumber() {
    return pageNumber;
  }
}
