package com.rabbitresilience.core.infrastructure.messaging;

import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Channel-level broker primitives. A channel is single-writer: it must not be used by two threads at once.
 */
public interface BrokerChannel extends AutoCloseable {

  void declareExchange(String name, String type, boolean durable, Map<String, Object> args);

  /** Passive declare: fails with a NOT_FOUND channel error when the exchange does not exist. */
  void checkExchange(String name);

  void declareQueue(String name, boolean durable, Map<String, Object> args);

  void bindQueue(String queue, String exchange, String routingKey, Map<String, Object> args);

  void bindExchange(String destination, String source, String routingKey, Map<String, Object> args);

  void qos(int prefetchCount);

  /** Turns on publisher confirms and tracking of returned (unroutable) messages. */
  void enableDeliveryConfirmation();

  /**
   * Publishes and, when confirmations are enabled, waits for the broker's confirm.
   *
   * @throws UnroutableMessageException if {@code mandatory} is set and the broker returned the message
   */
  void publish(String exchange, String routingKey, byte[] body, PublishProperties properties, boolean mandatory);

  /**
   * Consumes {@code queue} with manual acknowledgement and blocks until the channel closes (thrown as a
   * transport error) or {@code active} turns false (the subscription is cancelled and the call returns).
   */
  void subscribe(String queue, DeliveryHandler handler, BooleanSupplier active);

  void ack(long deliveryTag);

  void nack(long deliveryTag, boolean requeue);

  boolean isOpen();

  @Override
  void close();
}
