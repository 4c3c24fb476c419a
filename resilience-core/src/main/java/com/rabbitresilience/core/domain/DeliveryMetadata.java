package com.rabbitresilience.core.domain;

import java.util.Map;

public record DeliveryMetadata(long deliveryTag, boolean redelivered, String exchange, String routingKey,
                               Map<String, Object> headers, String messageId, String correlationId) {

  public DeliveryMetadata {
    headers = headers == null ? Map.of() : headers;
  }
}
