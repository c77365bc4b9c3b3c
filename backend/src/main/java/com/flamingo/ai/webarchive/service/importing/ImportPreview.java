package com.flamingo.ai.webarchive.service.importing;

import java.util.List;

/** What an import list would do for a user, computed without importing anything. */
public record ImportPreview(
    int totalUrls,
    int newUrls,
    int duplicateUrls,
    List<ImportItem> preview,
    boolean hasMore,
    List<ImportItem> duplicatesPreview) {}
