package com.flamingo.ai.specchunker.ingestion.pipeline;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs page tasks ahead of the consumer on an executor, with at most {@code depth} pages in
 * flight, and hands the results back strictly in page order.
 *
 * <p>Without an executor every page runs on the calling thread when it is requested. Closing the
 * prefetcher turns pages that have not started into gaps and waits for running ones, so the
 * document can be closed safely afterwards.
 */
@Slf4j
final class PagePrefetcher implements AutoCloseable {

  static final String CLOSED_REASON = "run stopped before page was extracted";

  private final Executor executor;
  private final int depth;
  private final int lastPage;
  private final IntFunction<PageOutcome> task;
  private final Deque<CompletableFuture<PageOutcome>> window = new ArrayDeque<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private int nextPage;

  PagePrefetcher(
      Executor executor, int depth, int firstPage, int lastPage, IntFunction<PageOutcome> task) {
    this.executor = executor;
    this.depth = executor == null ? 1 : Math.max(1, depth);
    this.lastPage = lastPage;
    this.task = task;
    this.nextPage = firstPage;
  }

  boolean hasNext() {
    return !window.isEmpty() || nextPage <= lastPage;
  }

  /** Returns the outcome of the next page, waiting for it if necessary. */
  PageOutcome next() {
    fill();
    CompletableFuture<PageOutcome> head = window.pollFirst();
    if (head == null) {
      throw new NoSuchElementException("No page after " + lastPage);
    }
    PageOutcome outcome;
    try {
      outcome = head.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw e;
    }
    fill();
    return outcome;
  }

  private void fill() {
    while (window.size() < depth && nextPage <= lastPage) {
      int page = nextPage++;
      if (executor == null) {
        window.addLast(CompletableFuture.completedFuture(task.apply(page)));
      } else {
        window.addLast(CompletableFuture.supplyAsync(() -> runPage(page), executor));
      }
    }
  }

  private PageOutcome runPage(int page) {
    if (closed.get()) {
      return PageOutcome.skipped(page, CLOSED_REASON);
    }
    return task.apply(page);
  }

  @Override
  public void close() {
    closed.set(true);
    for (CompletableFuture<PageOutcome> pending : window) {
      try {
        pending.join();
      } catch (CompletionException e) {
        log.debug("Discarded page task failed after the run stopped: {}", e.getMessage());
      }
    }
    window.clear();
  }
}
