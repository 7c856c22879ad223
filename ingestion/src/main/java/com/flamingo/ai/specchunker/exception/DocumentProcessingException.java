package com.flamingo.ai.specchunker.exception;

/** Exception thrown when a source document cannot be ingested at all. */
public class DocumentProcessingException extends RuntimeException {

  private final String source;
  private final String userMessage;

  public DocumentProcessingException(String source, String message) {
    super(message);
    this.source = source;
    this.userMessage = "Failed to ingest document";
  }

  public DocumentProcessingException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
    this.userMessage = "Failed to ingest document";
  }

  public DocumentProcessingException(String source, String message, String userMessage) {
    super(message);
    this.source = source;
    this.userMessage = userMessage;
  }

  public String getSource() {
    return source;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
