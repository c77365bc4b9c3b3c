package com.flamingo.ai.webarchive.service.importing;

/**
 * Cumulative counters reported after each item.
 *
 * @param processed items accounted for so far, including duplicates filtered before the run
 */
public record ImportProgress(
    int processed,
    int total,
    int successful,
    int failed,
    String currentUrl,
    ImportResult currentResult) {}
