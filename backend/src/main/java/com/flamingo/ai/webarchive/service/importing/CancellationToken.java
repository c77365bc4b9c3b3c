package com.flamingo.ai.webarchive.service.importing;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation flag checked by the import loop before each batch. */
public class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
