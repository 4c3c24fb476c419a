package com.rabbitresilience.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class MessageEnvelope {
  private final JsonNode body;
  private final Map<String, Object> headers;
  private final String messageId;
  private final String correlationId;

  public MessageEnvelope(JsonNode body, Map<String, Object> headers, String messageId, String correlationId) {
    this.body = Objects.requireNonNull(body, "body");
    this.headers = headers == null || headers.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    this.messageId = messageId;
    this.correlationId = correlationId;
  }

  public static MessageEnvelope of(JsonNode body) {
    return new MessageEnvelope(body, Map.of(), null, null);
  }

  public JsonNode getBody() { return body; }
  public Map<String, Object> getHeaders() { return headers; }
  public String getMessageId() { return messageId; }
  public String getCorrelationId() { return correlationId; }

  public Object header(String name) {
    return headers.get(name);
  }

  /** Value of {@code x-attempt}, 0 when the message has never been redriven. */
  public int attempt() {
    Object raw = headers.get(RetryHeaders.ATTEMPT);
    if (raw == null) return 0;
    if (raw instanceof Number n) return n.intValue();
    try {
      return Integer.parseInt(raw.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Malformed " + RetryHeaders.ATTEMPT + " header: '" + raw + "'", e);
    }
  }

  public MessageEnvelope withHeaders(Map<String, Object> newHeaders) {
    return new MessageEnvelope(body, newHeaders, messageId, correlationId);
  }

  public MessageEnvelope withMessageId(String id) {
    return new MessageEnvelope(body, headers, id, correlationId);
  }

  @Override
  public String toString() {
    return "MessageEnvelope{messageId=" + messageId + ", headers=" + headers + ", body=" + body + "}";
  }
}
