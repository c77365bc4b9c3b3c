package com.flamingo.ai.webarchive.service.importing;

import java.util.List;

/**
 * Final counters of an import run.
 *
 * <p>{@code total = successful + failed + skipped + cancelled}. Pre-run duplicates are counted in
 * both {@code duplicates} and {@code skipped}; {@code cancelled} counts items never started because
 * the run was cancelled. {@code results} holds one entry per item that was processed, in
 * completion order.
 */
public record ImportSummary(
    int total,
    int successful,
    int failed,
    int skipped,
    int duplicates,
    int cancelled,
    List<ImportResult> results) {

  public ImportSummary {
    results = List.copyOf(results);
  }
}
