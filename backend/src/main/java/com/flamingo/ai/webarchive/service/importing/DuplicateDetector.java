package com.flamingo.ai.webarchive.service.importing;

import com.flamingo.ai.webarchive.config.ArchiveConfig;
import com.flamingo.ai.webarchive.domain.repository.ArchiveRecordRepository;
import com.google.common.collect.Lists;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Finds which urls of an import list the user has already archived.
 *
 * <p>Existence is queried in fixed-size batches. A failing batch is treated as "no duplicates"
 * (fail-open): the worst case is re-attempting a few archived urls, which the per-item re-check and
 * the unique (user, url) key then catch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DuplicateDetector {

  private final ArchiveRecordRepository archiveRecordRepository;
  private final ArchiveConfig archiveConfig;
  private final MeterRegistry meterRegistry;

  public DuplicatePartition partition(List<ImportItem> items, UUID userId) {
    List<String> distinctUrls = items.stream().map(ImportItem::url).distinct().toList();
    Set<String> archived = new HashSet<>();
    int batchSize = archiveConfig.getImporting().getDuplicateCheckBatchSize();

    for (List<String> batch : Lists.partition(distinctUrls, batchSize)) {
      try {
        archived.addAll(archiveRecordRepository.findArchivedUrls(userId, batch));
      } catch (DataAccessException e) {
        log.warn(
            "Duplicate check failed for {} urls of user {}, treating them as new: {}",
            batch.size(),
            userId,
            e.getMessage());
        meterRegistry.counter("import.duplicate_check.failures").increment();
      }
    }

    List<ImportItem> fresh = new ArrayList<>();
    List<ImportItem> duplicates = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (ImportItem item : items) {
      if (archived.contains(item.url()) || !seen.add(item.url())) {
        duplicates.add(item);
      } else {
        fresh.add(item);
      }
    }

    log.info(
        "Duplicate check: {} duplicates found, {} new URLs to import",
        duplicates.size(),
        fresh.size());
    return new DuplicatePartition(fresh, duplicates);
  }
}
