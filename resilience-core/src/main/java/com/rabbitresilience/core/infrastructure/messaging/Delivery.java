package com.rabbitresilience.core.infrastructure.messaging;

import java.util.Map;

/** A raw message as handed over by the transport. String header values are plain {@link String}s. */
public record Delivery(long deliveryTag, boolean redelivered, String exchange, String routingKey,
                       Map<String, Object> headers, String messageId, String correlationId, Integer priority,
                       byte[] body) {

  public Delivery {
    headers = headers == null ? Map.of() : headers;
    body = body == null ? new byte[0] : body;
  }
}
