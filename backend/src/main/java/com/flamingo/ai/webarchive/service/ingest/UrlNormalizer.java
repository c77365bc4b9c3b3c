package com.flamingo.ai.webarchive.service.ingest;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Canonical form used as the archive key: trimmed, scheme and host lower-cased, fragment dropped.
 * Path and query are kept verbatim.
 */
@Component
@Slf4j
public class UrlNormalizer {

  public String normalize(String url) {
    if (url == null) {
      return null;
    }
    String trimmed = url.trim();
    try {
      URI uri = new URI(trimmed);
      if (uri.getScheme() == null || uri.getRawAuthority() == null) {
        return trimmed;
      }
      StringBuilder normalized =
          new StringBuilder()
              .append(uri.getScheme().toLowerCase(Locale.ROOT))
              .append("://")
              .append(lowerCaseHost(uri.getRawAuthority()));
      if (uri.getRawPath() != null) {
        normalized.append(uri.getRawPath());
      }
      if (uri.getRawQuery() != null) {
        normalized.append('?').append(uri.getRawQuery());
      }
      return normalized.toString();
    } catch (URISyntaxException e) {
      log.debug("Keeping unparseable url as-is: {}", e.getMessage());
      return trimmed;
    }
  }

  /** Lower-cases the host part of an authority, leaving any user info untouched. */
  private static String lowerCaseHost(String authority) {
    int at = authority.lastIndexOf('@');
    if (at < 0) {
      return authority.toLowerCase(Locale.ROOT);
    }
    return authority.substring(0, at + 1) + authority.substring(at + 1).toLowerCase(Locale.ROOT);
  }
}
