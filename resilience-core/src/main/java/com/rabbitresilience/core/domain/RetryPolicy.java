package com.rabbitresilience.core.domain;

import org.springframework.amqp.core.ExchangeTypes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dead-letter based retry of consumed messages.
 *
 * <p>When enabled, failed messages are republished to {@code <queue>.<retryQueueSuffix>} with a
 * per-message TTL; the retry queue dead-letters them back to the original exchange and routing key.
 */
public record RetryPolicy(boolean enabled, String retryQueueSuffix, int maxRetries, int backoffBase,
                          long retryDelaySeconds) {

  public static final String DEFAULT_RETRY_QUEUE_SUFFIX = "retry";
  public static final int DEFAULT_MAX_RETRIES = 20;
  public static final int DEFAULT_BACKOFF_BASE = 2;
  public static final long DEFAULT_RETRY_DELAY_SECONDS = 5;

  public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
  public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";

  public RetryPolicy {
    retryQueueSuffix = (retryQueueSuffix == null || retryQueueSuffix.isBlank()) ? DEFAULT_RETRY_QUEUE_SUFFIX : retryQueueSuffix;
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    if (backoffBase < 1) throw new IllegalArgumentException("backoffBase must be >= 1");
    if (retryDelaySeconds < 0) throw new IllegalArgumentException("retryDelaySeconds must not be negative");
  }

  public static RetryPolicy disabled() {
    return new RetryPolicy(false, DEFAULT_RETRY_QUEUE_SUFFIX, DEFAULT_MAX_RETRIES, DEFAULT_BACKOFF_BASE, DEFAULT_RETRY_DELAY_SECONDS);
  }

  public static RetryPolicy enabled(int maxRetries) {
    return new RetryPolicy(true, DEFAULT_RETRY_QUEUE_SUFFIX, maxRetries, DEFAULT_BACKOFF_BASE, DEFAULT_RETRY_DELAY_SECONDS);
  }

  public String retryQueueName(TopologyDescriptor primary) {
    return primary.queueName() + "." + retryQueueSuffix;
  }

  /**
   * Topology of the retry queue for {@code primary}: exchange, queue and routing key share the retry
   * queue name, and expired messages dead-letter back to the primary exchange and routing key.
   */
  public TopologyDescriptor retryTopology(TopologyDescriptor primary) {
    if (!primary.hasQueue()) throw new IllegalStateException("Retry topology needs a primary queue");
    String name = retryQueueName(primary);
    Map<String, Object> args = new LinkedHashMap<>();
    args.put(DEAD_LETTER_EXCHANGE, primary.exchangeName());
    args.put(DEAD_LETTER_ROUTING_KEY, primary.routingKey());
    return TopologyDescriptor.builder(name)
        .exchangeType(ExchangeTypes.DIRECT)
        .queueName(name)
        .routingKey(name)
        .queueArgs(args)
        .build();
  }
}
