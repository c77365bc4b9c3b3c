package com.flamingo.ai.webarchive.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Archives a user created recently, newest first. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportStatusResponse {

  private int recentImports;
  private List<ArchiveResponse> recentArchives;
}
