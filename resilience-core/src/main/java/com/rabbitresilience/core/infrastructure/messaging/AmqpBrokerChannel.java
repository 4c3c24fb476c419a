package com.rabbitresilience.core.infrastructure.messaging;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.LongString;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

class AmqpBrokerChannel implements BrokerChannel {
  private static final Logger log = LoggerFactory.getLogger(AmqpBrokerChannel.class);
  private static final long SUBSCRIBE_POLL_MS = 200;

  private final Channel channel;
  private final Duration confirmTimeout;
  // basic.return observed for a given message id; a return always precedes the confirm of the same message
  private final ConcurrentMap<String, Return> returnsSeen = new ConcurrentHashMap<>();
  private volatile boolean confirmsEnabled;

  AmqpBrokerChannel(Channel channel, Duration confirmTimeout) {
    this.channel = channel;
    this.confirmTimeout = confirmTimeout;
  }

  @Override
  public void declareExchange(String name, String type, boolean durable, Map<String, Object> args) {
    try {
      channel.exchangeDeclare(name, type, durable, false, nullIfEmpty(args));
    } catch (IOException | ShutdownSignalException e) {
      throw TransportErrors.translate(e);
    }
  }

  @Override
  public void checkExchange(String name) {
    try {
      channel.exchangeDeclarePassive(name);
    } catch (IOException | ShutdownSignalException e) {
      throw TransportErrors.translate(e);
    }
  }

  @Override
  public void declareQueue(String name, boolean durable, Map<String, Object> args) {
    try {
      channel.queueDeclare(name, durable, false, false, nullIfEmpty(args));
    } catch (IOException | ShutdownSignalException e) {
      throw TransportErrors.translate(e);
    }
  }

  @Override
  public void bindQueue(String queue, String exchange, String routingKey, Map<String, Object> args) {
    try {
      channel.queueBind(queue, exchange, routingKey, nullIfEmpty(args));
    } catch (IOException | ShutdownSignalException e) {
      throw TransportErrors.translate(e);
    }
  }

  @Override
  public void bindExchange(String destination, String source, String routingKey, Map<String, Object> args) {
    try {
      channel.exchangeBind(destination, source, routingKey, nullIfEmpty(args));
    } catch (IOException | ShutdownSignalException e) {
      throw TransportErrors.translate(e);
    }
  }

  @Override
  public void qos(int prefetchCount) {
    try {
      channel.basicQos(prefetchCount);
    } catch (IOException | ShutdownSignalException e) {
      throw TransportErrors.translate(e);
    }
  }

  @Override
  public void enableDeliveryConfirmation() {
    try {
      channel.confirmSelect();
    } catch (IOException | ShutdownSignalException e) {
      throw TransportErrors.translate(e);
    }
    channel.addReturnListener(ret -> {
      String id = ret.getProperties() != null ? ret.getProperties().getMessageId() : null;
      if (id != null) returnsSeen.put(id, ret);
      log.warn("Rabbit RETURNED (unroutable): replyCode={}, replyText={}, exchange={}, routingKey={}, messageId={}",
          ret.getReplyCode(), ret.getReplyText(), ret.getExchange(), ret.getRoutingKey(), id);
    });
    confirmsEnabled = true;
  }

  @Override
  public void publish(String exchange, String routingKey, byte[] body, PublishProperties properties, boolean mandatory) {
    String messageId = properties.messageId() != null ? properties.messageId() : UUID.randomUUID().toString();
    // clear a stale flag from a previous attempt with the same id
    returnsSeen.remove(messageId);
    try {
      channel.basicPublish(exchange, routingKey, mandatory, toBasicProperties(properties, messageId), body);
      if (confirmsEnabled) {
        channel.waitForConfirmsOrDie(confirmTimeout.toMillis());
      }
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      throw TransportErrors.translate(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException("Interrupted while waiting for publisher confirm of " + messageId, e);
    }
    Return returned = returnsSeen.remove(messageId);
    if (mandatory && returned != null) {
      throw new UnroutableMessageException(returned.getReplyCode(), returned.getReplyText(),
          returned.getExchange(), returned.getRoutingKey());
    }
  }

  @Override
  public void subscribe(String queue, DeliveryHandler handler, BooleanSupplier active) {
    CompletableFuture<Throwable> stopped = new CompletableFuture<>();
    ShutdownListener onShutdown = stopped::complete;
    channel.addShutdownListener(onShutdown);
    String consumerTag;
    try {
      consumerTag = channel.basicConsume(queue, false,
          (tag, message) -> handler.onDelivery(toDelivery(message)),
          tag -> stopped.complete(new IOException("Consumer " + tag + " was cancelled by the broker")));
    } catch (IOException | ShutdownSignalException e) {
      channel.removeShutdownListener(onShutdown);
      throw TransportErrors.translate(e);
    }
    log.info("Consuming queue {} with consumerTag {}", queue, consumerTag);
    try {
      while (active.getAsBoolean()) {
        try {
          Throwable cause = stopped.get(SUBSCRIBE_POLL_MS, TimeUnit.MILLISECONDS);
          throw TransportErrors.translate(cause);
        } catch (TimeoutException e) {
          // still consuming
        }
      }
      cancel(consumerTag);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel(consumerTag);
    } catch (ExecutionException e) {
      throw TransportErrors.translate(e.getCause());
    } finally {
      channel.removeShutdownListener(onShutdown);
    }
  }

  @Override
  public void ack(long deliveryTag) {
    try {
      channel.basicAck(deliveryTag, false);
    } catch (IOException | ShutdownSignalException e) {
      throw TransportErrors.translate(e);
    }
  }

  @Override
  public void nack(long deliveryTag, boolean requeue) {
    try {
      channel.basicNack(deliveryTag, false, requeue);
    } catch (IOException | ShutdownSignalException e) {
      throw TransportErrors.translate(e);
    }
  }

  @Override
  public boolean isOpen() {
    return channel.isOpen();
  }

  @Override
  public void close() {
    if (!channel.isOpen()) return;
    try {
      channel.close();
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      log.debug("Ignoring error while closing channel {}", channel.getChannelNumber(), e);
    }
  }

  private void cancel(String consumerTag) {
    if (!channel.isOpen()) return;
    try {
      channel.basicCancel(consumerTag);
      log.info("Cancelled consumer {}", consumerTag);
    } catch (IOException | ShutdownSignalException e) {
      log.debug("Ignoring error while cancelling consumer {}", consumerTag, e);
    }
  }

  private static AMQP.BasicProperties toBasicProperties(PublishProperties p, String messageId) {
    AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder()
        .deliveryMode(p.deliveryMode())
        .priority(p.priority())
        .headers(p.headers().isEmpty() ? null : new HashMap<>(p.headers()))
        .messageId(messageId)
        .correlationId(p.correlationId())
        .contentType(p.contentType());
    if (p.expirationMs() != null) {
      builder.expiration(Long.toString(p.expirationMs()));
    }
    return builder.build();
  }

  private static Delivery toDelivery(com.rabbitmq.client.Delivery message) {
    AMQP.BasicProperties props = message.getProperties();
    return new Delivery(
        message.getEnvelope().getDeliveryTag(),
        message.getEnvelope().isRedeliver(),
        message.getEnvelope().getExchange(),
        message.getEnvelope().getRoutingKey(),
        normalize(props != null ? props.getHeaders() : null),
        props != null ? props.getMessageId() : null,
        props != null ? props.getCorrelationId() : null,
        props != null ? props.getPriority() : null,
        message.getBody());
  }

  private static Map<String, Object> normalize(Map<String, Object> headers) {
    if (headers == null || headers.isEmpty()) return Map.of();
    Map<String, Object> out = new LinkedHashMap<>();
    headers.forEach((k, v) -> out.put(k, v instanceof LongString ls ? ls.toString() : v));
    return out;
  }

  private static Map<String, Object> nullIfEmpty(Map<String, Object> args) {
    return args == null || args.isEmpty() ? null : new HashMap<>(args);
  }
}
