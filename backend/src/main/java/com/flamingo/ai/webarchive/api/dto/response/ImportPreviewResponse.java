package com.flamingo.ai.webarchive.api.dto.response;

import com.flamingo.ai.webarchive.service.importing.ImportItem;
import com.flamingo.ai.webarchive.service.importing.ImportPreview;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Response DTO for an import preview. */
@Value
@Builder
public class ImportPreviewResponse {

  boolean valid;
  int totalUrls;
  int newUrls;
  int duplicateUrls;
  List<ImportItem> preview;
  boolean hasMore;
  List<DuplicateEntry> duplicatesPreview;

  public static ImportPreviewResponse from(ImportPreview preview) {
    return ImportPreviewResponse.builder()
        .valid(true)
        .totalUrls(preview.totalUrls())
        .newUrls(preview.newUrls())
        .duplicateUrls(preview.duplicateUrls())
        .preview(preview.preview())
        .hasMore(preview.hasMore())
        .duplicatesPreview(
            preview.duplicatesPreview().stream()
                .map(item -> new DuplicateEntry(item.url(), item.title()))
                .toList())
        .build();
  }

  /** A url that is already archived. */
  public record DuplicateEntry(String url, String title) {}
}
