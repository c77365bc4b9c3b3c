package com.flamingo.ai.webarchive.service.ingest;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/** Content address of a chunk: hex SHA-256 of {@code url + ":" + content}. */
@Component
public class ContentHasher {

  public String hash(String url, String content) {
    return Hashing.sha256().hashString(url + ":" + content, StandardCharsets.UTF_8).toString();
  }
}
