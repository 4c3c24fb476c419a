package com.rabbitresilience.core.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitresilience.core.config.PublisherConfig;
import com.rabbitresilience.core.domain.MessageEnvelope;
import com.rabbitresilience.core.domain.PublishOptions;
import com.rabbitresilience.core.domain.TopologyDescriptor;
import com.rabbitresilience.core.infrastructure.messaging.BrokerChannel;
import com.rabbitresilience.core.infrastructure.messaging.BrokerConnection;
import com.rabbitresilience.core.infrastructure.messaging.PublishProperties;
import com.rabbitresilience.core.infrastructure.messaging.TransportErrors;
import com.rabbitresilience.core.infrastructure.messaging.UnroutableMessageException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class ResilientPublisher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ResilientPublisher.class);

  private final PublisherConfig config;
  private final TopologyDescriptor topology;
  private final ObjectMapper mapper;
  private final ConnectionResilienceManager resilience;
  private final TopologyBinder binder = new TopologyBinder();
  private final ConcurrentMap<String, BrokerConnection> connections = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, BrokerChannel> channels = new ConcurrentHashMap<>();
  private final Object connectionLock = new Object();
  private final Counter published;
  private final Counter returned;
  private final Counter retries;

  public ResilientPublisher(PublisherConfig config) {
    this.config = config;
    this.topology = config.getTopology();
    this.mapper = config.getObjectMapper();
    MeterRegistry registry = config.getMeterRegistry();
    this.resilience = new ConnectionResilienceManager(config.getTransport(), config.getEndpoint(),
        new ErrorReporter(config.getErrorCallback()), config.getSleeper(), registry);
    this.published = registry.counter("rmq_published_total", "exchange", topology.exchangeName());
    this.returned = registry.counter("rmq_returned_total", "exchange", topology.exchangeName());
    this.retries = registry.counter("rmq_publish_retries_total", "exchange", topology.exchangeName());
  }

  public void publish(Object payload) {
    publish(payload, PublishOptions.NONE);
  }

  public void publish(Object payload, PublishOptions options) {
    publish(MessageEnvelope.of(toTree(payload)), options);
  }

  /** Publishes the envelope's body; {@code options.headers()} are merged over the envelope headers. */
  public void publish(MessageEnvelope envelope, PublishOptions options) {
    byte[] body = serialize(envelope.getBody());
    Map<String, Object> headers = new LinkedHashMap<>(envelope.getHeaders());
    headers.putAll(options.headers());
    // one id for every attempt, so a return can be matched to the attempt that caused it
    String messageId = envelope.getMessageId() != null ? envelope.getMessageId() : UUID.randomUUID().toString();
    PublishProperties properties = new PublishProperties(PublishProperties.PERSISTENT, PriorityMapper.map(options),
        headers, options.expirationMs(), messageId, envelope.getCorrelationId(), PublishProperties.CONTENT_TYPE_JSON);

    resilience.execute(new RetryCounter(), () -> publishOnce(body, properties));
  }

  private Void publishOnce(byte[] body, PublishProperties properties) {
    BrokerChannel channel = channel();
    try {
      channel.publish(topology.exchangeName(), topology.routingKey(), body, properties, true);
    } catch (UnroutableMessageException e) {
      returned.increment();
      log.warn("Message {} is unroutable via exchange={} routingKey={}", properties.messageId(),
          topology.exchangeName(), topology.routingKey());
      throw e;
    } catch (RuntimeException e) {
      if (TransportErrors.isRetryable(e)) {
        retries.increment();
        evict();
      }
      throw e;
    }
    published.increment();
    log.debug("Published {} to exchange={} routingKey={}", properties.messageId(), topology.exchangeName(),
        topology.routingKey());
    return null;
  }

  @Override
  public void close() {
    channels.values().forEach(BrokerChannel::close);
    channels.clear();
    connections.values().forEach(BrokerConnection::close);
    connections.clear();
    log.debug("Closed publisher for exchange {}", topology.exchangeName());
  }

  private BrokerChannel channel() {
    String key = channelKey();
    BrokerChannel cached = channels.get(key);
    if (cached != null && cached.isOpen()) return cached;
    BrokerConnection connection = connection();
    BrokerChannel channel;
    try {
      channel = connection.openChannel();
    } catch (RuntimeException e) {
      evictConnectionIfClosed();
      throw e;
    }
    try {
      channel.enableDeliveryConfirmation();
      if (config.isVerifyOnly()) {
        binder.verify(channel, topology);
      } else {
        binder.declare(channel, topology);
      }
    } catch (RuntimeException e) {
      channel.close();
      evictConnectionIfClosed();
      throw e;
    }
    channels.put(key, channel);
    return channel;
  }

  private BrokerConnection connection() {
    String pid = processKey();
    BrokerConnection cached = connections.get(pid);
    if (cached != null && cached.isOpen()) return cached;
    synchronized (connectionLock) {
      BrokerConnection current = connections.get(pid);
      if (current == null || !current.isOpen()) {
        current = resilience.openConnection();
        connections.put(pid, current);
        log.info("Publisher connected to {}:{} for exchange {}", config.getEndpoint().host(),
            config.getEndpoint().port(), topology.exchangeName());
      }
      return current;
    }
  }

  private void evict() {
    BrokerChannel channel = channels.remove(channelKey());
    if (channel != null) channel.close();
    evictConnectionIfClosed();
  }

  private void evictConnectionIfClosed() {
    String pid = processKey();
    BrokerConnection connection = connections.get(pid);
    if (connection != null && !connection.isOpen()) {
      connections.remove(pid, connection);
      connection.close();
    }
  }

  private JsonNode toTree(Object payload) {
    if (payload == null) return mapper.nullNode();
    if (payload instanceof JsonNode node) return node;
    try {
      return mapper.valueToTree(payload);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Failed to serialize message payload", e);
    }
  }

  private byte[] serialize(JsonNode body) {
    try {
      return mapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize message payload", e);
    }
  }

  private static String processKey() {
    return Long.toString(ProcessHandle.current().pid());
  }

  private static String channelKey() {
    return processKey() + "-" + Thread.currentThread().getId();
  }
}
