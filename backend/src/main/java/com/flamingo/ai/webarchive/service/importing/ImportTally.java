package com.flamingo.ai.webarchive.service.importing;

import java.util.ArrayList;
import java.util.List;

/** Mutable, thread-safe accumulator behind {@link ImportSummary}. */
class ImportTally {

  private final int total;
  private int successful;
  private int failed;
  private int skipped;
  private int duplicates;
  private int cancelled;
  private final List<ImportResult> results = new ArrayList<>();

  ImportTally(int total) {
    this.total = total;
  }

  synchronized void addDuplicates(int count) {
    duplicates += count;
    skipped += count;
  }

  synchronized void addCancelled(int count) {
    cancelled += count;
  }

  /** Records one item outcome and returns the progress after it. */
  synchronized ImportProgress record(ImportResult result) {
    if (!result.success()) {
      failed++;
    } else if (result.skipped()) {
      skipped++;
    } else {
      successful++;
    }
    results.add(result);
    return new ImportProgress(
        successful + failed + skipped, total, successful, failed, result.url(), result);
  }

  synchronized ImportSummary summary() {
    return new ImportSummary(
        total, successful, failed, skipped, duplicates, cancelled, new ArrayList<>(results));
  }
}
