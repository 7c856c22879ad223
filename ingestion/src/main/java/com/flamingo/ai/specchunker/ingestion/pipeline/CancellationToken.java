package com.flamingo.ai.specchunker.ingestion.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative stop signal for a pipeline run, checked at every page boundary. */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
