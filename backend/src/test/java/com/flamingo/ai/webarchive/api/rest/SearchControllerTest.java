package com.flamingo.ai.webarchive.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.webarchive.exception.GlobalExceptionHandler;
import com.flamingo.ai.webarchive.service.search.ArchiveSearchService;
import com.flamingo.ai.webarchive.service.search.MatchType;
import com.flamingo.ai.webarchive.service.search.SearchOutcome;
import com.flamingo.ai.webarchive.service.search.SearchResultGroup;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("SearchController Tests")
class SearchControllerTest {

  private MockMvc mockMvc;

  @Mock private ArchiveSearchService archiveSearchService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SearchController(archiveSearchService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should return grouped results with search metadata")
  void shouldSearch() throws Exception {
    UUID userId = UUID.randomUUID();
    SearchResultGroup group =
        new SearchResultGroup(
            UUID.randomUUID(),
            "Embedding models",
            "",
            "https://example.com",
            List.of("ai"),
            null,
            0.876,
            "**gemini** **embeddings**",
            List.of(),
            MatchType.SEMANTIC);
    when(archiveSearchService.search("gemini embeddings", userId, 5))
        .thenReturn(new SearchOutcome("gemini embeddings", List.of(group), true, true, 42));

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"query\":\"gemini embeddings\",\"userId\":\"" + userId + "\",\"limit\":5}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.mode").value("hybrid"))
        .andExpect(jsonPath("$.totalCount").value(1))
        .andExpect(jsonPath("$.results[0].snippet").value("**gemini** **embeddings**"))
        .andExpect(jsonPath("$.metadata.avgRelevance").value(0.88))
        .andExpect(jsonPath("$.metadata.semanticEnabled").value(true));
  }

  @Test
  @DisplayName("Should reject a blank query")
  void shouldRejectBlankQuery() throws Exception {
    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\" \",\"userId\":\"" + UUID.randomUUID() + "\"}"))
        .andExpect(status().isBadRequest());

    verify(archiveSearchService, never()).search(any(), any(), any());
  }

  @Test
  @DisplayName("Should reject a limit above 100")
  void shouldRejectLargeLimit() throws Exception {
    UUID userId = UUID.randomUUID();

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"q\",\"userId\":\"" + userId + "\",\"limit\":500}"))
        .andExpect(status().isBadRequest());

    verify(archiveSearchService, never()).search(any(), eq(userId), any());
  }
}
