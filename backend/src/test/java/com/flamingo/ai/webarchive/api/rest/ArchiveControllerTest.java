package com.flamingo.ai.webarchive.api.rest;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.webarchive.domain.entity.ArchiveRecord;
import com.flamingo.ai.webarchive.exception.ArchiveNotFoundException;
import com.flamingo.ai.webarchive.exception.GlobalExceptionHandler;
import com.flamingo.ai.webarchive.service.archive.ArchiveService;
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
@DisplayName("ArchiveController and AdminController Tests")
class ArchiveControllerTest {

  private MockMvc mockMvc;

  @Mock private ArchiveService archiveService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new ArchiveController(archiveService), new AdminController(archiveService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should list a user's archives")
  void shouldListArchives() throws Exception {
    UUID userId = UUID.randomUUID();
    ArchiveRecord archive =
        ArchiveRecord.builder()
            .id(UUID.randomUUID())
            .userId(userId)
            .url("https://example.com")
            .title("Example")
            .textContent("full text")
            .build();
    when(archiveService.listForUser(userId)).thenReturn(List.of(archive));

    mockMvc
        .perform(get("/api/archives/user/{userId}", userId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].title").value("Example"))
        .andExpect(jsonPath("$[0].url").value("https://example.com"));
  }

  @Test
  @DisplayName("Should return 404 for an unknown archive")
  void shouldReturnNotFound() throws Exception {
    UUID archiveId = UUID.randomUUID();
    when(archiveService.get(archiveId)).thenThrow(new ArchiveNotFoundException(archiveId));

    mockMvc
        .perform(get("/api/archives/{archiveId}", archiveId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ARCHIVE_001"));
  }

  @Test
  @DisplayName("Should delete an archive")
  void shouldDeleteArchive() throws Exception {
    UUID archiveId = UUID.randomUUID();

    mockMvc
        .perform(delete("/api/archives/{archiveId}", archiveId))
        .andExpect(status().isNoContent());

    verify(archiveService).delete(archiveId);
  }

  @Test
  @DisplayName("Should reprocess embeddings and report the count")
  void shouldReprocessEmbeddings() throws Exception {
    UUID userId = UUID.randomUUID();
    when(archiveService.reprocessEmbeddings(userId)).thenReturn(4);

    mockMvc
        .perform(
            post("/api/admin/reprocess-embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"" + userId + "\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.processedCount").value(4));
  }
}
