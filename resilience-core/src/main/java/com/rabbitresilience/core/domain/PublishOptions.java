package com.rabbitresilience.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-publish settings.
 *
 * @param priority explicit numeric priority (0..255), wins over {@code highPriority}
 * @param highPriority ask for the reserved high priority when no explicit value is given
 * @param expirationMs per-message TTL, {@code null} for none
 * @param headers extra headers merged over the envelope's own
 */
public record PublishOptions(Integer priority, boolean highPriority, Long expirationMs, Map<String, Object> headers) {

  public static final PublishOptions NONE = new PublishOptions(null, false, null, Map.of());

  public PublishOptions {
    if (priority != null && (priority < 0 || priority > 255)) {
      throw new IllegalArgumentException("priority must be within 0..255: " + priority);
    }
    if (expirationMs != null && expirationMs < 0) {
      throw new IllegalArgumentException("expirationMs must not be negative");
    }
    headers = headers == null || headers.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  public static PublishOptions priority(int priority) {
    return new PublishOptions(priority, false, null, Map.of());
  }

  public static PublishOptions high() {
    return new PublishOptions(null, true, null, Map.of());
  }
}
