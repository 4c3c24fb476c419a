package com.rabbitresilience.core.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.rabbitresilience.core.domain.AckDecision;
import com.rabbitresilience.core.domain.DeliveryMetadata;

/**
 * Application handler for consumed messages. Returning {@code null} is the same as
 * {@link AckDecision#USE_DEFAULT}; throwing hands the message to the retry path.
 */
@FunctionalInterface
public interface MessageCallback {

  AckDecision onMessage(JsonNode payload, DeliveryMetadata metadata) throws Exception;
}
