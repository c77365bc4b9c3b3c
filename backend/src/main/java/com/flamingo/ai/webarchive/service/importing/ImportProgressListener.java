package com.flamingo.ai.webarchive.service.importing;

/**
 * Observes an import run. Called from worker threads, possibly concurrently, once per processed
 * item; implementations must be thread-safe and must not block.
 */
@FunctionalInterface
public interface ImportProgressListener {

  ImportProgressListener NONE = progress -> {};

  void onProgress(ImportProgress progress);
}
