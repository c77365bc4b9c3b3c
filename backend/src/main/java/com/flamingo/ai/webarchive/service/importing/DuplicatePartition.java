package com.flamingo.ai.webarchive.service.importing;

import java.util.List;

/**
 * Split of an import list into items to process and items already archived.
 *
 * @param fresh items not archived yet, in input order
 * @param duplicates items already archived for the user, or repeated within the list
 */
public record DuplicatePartition(List<ImportItem> fresh, List<ImportItem> duplicates) {

  public DuplicatePartition {
    fresh = List.copyOf(fresh);
    duplicates = List.copyOf(duplicates);
  }
}
