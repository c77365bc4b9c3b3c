package com.flamingo.ai.webarchive.service.importing;

import java.time.Instant;
import java.util.List;

/**
 * One row of an import list.
 *
 * @param url normalized page url
 * @param title title given by the list, used when extraction finds none
 * @param tags distinct tags in list order
 * @param archived whether the source service had the item archived
 */
public record ImportItem(
    String url, String title, List<String> tags, Instant timeAdded, boolean archived) {

  public ImportItem {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
