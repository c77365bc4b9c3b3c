package com.flamingo.ai.webarchive.api.rest;

import com.flamingo.ai.webarchive.api.dto.request.ArchiveSearchRequest;
import com.flamingo.ai.webarchive.api.dto.response.SearchResponse;
import com.flamingo.ai.webarchive.service.search.ArchiveSearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for archive search. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

  private final ArchiveSearchService archiveSearchService;

  @PostMapping
  public ResponseEntity<SearchResponse> search(@Valid @RequestBody ArchiveSearchRequest request) {
    return ResponseEntity.ok(
        SearchResponse.from(
            archiveSearchService.search(
                request.getQuery(), request.getUserId(), request.getLimit())));
  }
}
