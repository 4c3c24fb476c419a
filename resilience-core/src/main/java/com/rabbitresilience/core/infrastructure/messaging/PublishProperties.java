package com.rabbitresilience.core.infrastructure.messaging;

import java.util.Map;

/**
 * Message properties understood by the transport.
 *
 * @param deliveryMode 2 for persistent
 * @param expirationMs per-message TTL, {@code null} for none
 */
public record PublishProperties(int deliveryMode, Integer priority, Map<String, Object> headers, Long expirationMs,
                                String messageId, String correlationId, String contentType) {

  public static final int PERSISTENT = 2;
  public static final String CONTENT_TYPE_JSON = "application/json";

  public PublishProperties {
    headers = headers == null ? Map.of() : headers;
  }
}
