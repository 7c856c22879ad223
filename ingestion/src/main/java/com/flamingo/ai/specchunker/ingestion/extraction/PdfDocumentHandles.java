package com.flamingo.ai.specchunker.ingestion.extraction;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

/**
 * Per-thread read-only {@link PDDocument} handles over one in-memory PDF.
 *
 * <p>{@code PDDocument} is not thread-safe, so every thread that reads pages loads its own handle
 * from the shared byte array on first use. All handles are closed together.
 */
@Slf4j
final class PdfDocumentHandles implements AutoCloseable {

  private final byte[] bytes;
  private final ThreadLocal<PDDocument> handle = new ThreadLocal<>();
  private final Queue<PDDocument> opened = new ConcurrentLinkedQueue<>();
  private volatile boolean closed;

  PdfDocumentHandles(byte[] bytes) {
    this.bytes = bytes;
  }

  /** Returns the calling thread's handle, loading it on first use. */
  PDDocument current() throws IOException {
    if (closed) {
      throw new IOException("Document handles already closed");
    }
    PDDocument document = handle.get();
    if (document == null) {
      document = Loader.loadPDF(bytes);
      handle.set(document);
      opened.add(document);
      log.debug("Opened PDF handle on thread {}", Thread.currentThread().getName());
    }
    return document;
  }

  @Override
  public void close() {
    closed = true;
    PDDocument document;
    while ((document = opened.poll()) != null) {
      try {
        document.close();
      } catch (IOException e) {
        log.warn("Failed to close PDF handle: {}", e.getMessage());
      }
    }
    handle.remove();
  }
}
