package com.rabbitresilience.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitresilience.core.application.ErrorCallback;
import com.rabbitresilience.core.domain.EndpointIdentity;
import com.rabbitresilience.core.domain.RetryPolicy;
import com.rabbitresilience.core.domain.TopologyDescriptor;
import com.rabbitresilience.core.infrastructure.messaging.AmqpBrokerTransport;
import com.rabbitresilience.core.infrastructure.messaging.BrokerTransport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.time.Clock;
import java.util.Objects;

/**
 * Settings of a {@link com.rabbitresilience.core.application.ResilientConsumer}.
 *
 * <p>Defaults: {@code autoAck=true} (a callback that returns no decision acks), {@code prefetchCount=1},
 * dead-letter retry off with suffix {@code retry}, {@code maxRetries=20}, {@code backoffBase=2} and the
 * endpoint's retry delay as backoff unit.
 */
public final class ConsumerConfig {
  public static final int DEFAULT_PREFETCH_COUNT = 1;

  private final EndpointIdentity endpoint;
  private final TopologyDescriptor topology;
  private final RetryPolicy retryPolicy;
  private final boolean autoAck;
  private final int prefetchCount;
  private final ErrorCallback errorCallback;
  private final BrokerTransport transport;
  private final Sleeper sleeper;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final ObjectMapper objectMapper;

  private ConsumerConfig(Builder b) {
    this.endpoint = b.endpoint != null ? b.endpoint : EndpointIdentity.builder().build();
    this.topology = Objects.requireNonNull(b.topology, "topology");
    if (!topology.hasQueue() || topology.routingKey().isEmpty()) {
      throw new IllegalArgumentException("A consumer needs a queueName and a routingKey");
    }
    long delaySeconds = b.retryDelaySeconds != null ? b.retryDelaySeconds : endpoint.retryDelay().toSeconds();
    this.retryPolicy = new RetryPolicy(b.dlkRetryEnabled, b.retryQueueSuffix, b.maxRetries, b.backoffBase, delaySeconds);
    this.autoAck = b.autoAck;
    if (b.prefetchCount < 0) throw new IllegalArgumentException("prefetchCount must not be negative");
    this.prefetchCount = b.prefetchCount;
    this.errorCallback = b.errorCallback;
    this.transport = b.transport != null ? b.transport : new AmqpBrokerTransport();
    this.sleeper = b.sleeper != null ? b.sleeper : new ThreadWaitSleeper();
    this.clock = b.clock != null ? b.clock : Clock.systemUTC();
    this.meterRegistry = b.meterRegistry != null ? b.meterRegistry : Metrics.globalRegistry;
    this.objectMapper = b.objectMapper != null ? b.objectMapper : new ObjectMapper();
  }

  public static Builder builder(TopologyDescriptor topology) {
    return new Builder(topology);
  }

  public EndpointIdentity getEndpoint() { return endpoint; }
  public TopologyDescriptor getTopology() { return topology; }
  public RetryPolicy getRetryPolicy() { return retryPolicy; }
  public boolean isAutoAck() { return autoAck; }
  public int getPrefetchCount() { return prefetchCount; }
  public ErrorCallback getErrorCallback() { return errorCallback; }
  public BrokerTransport getTransport() { return transport; }
  public Sleeper getSleeper() { return sleeper; }
  public Clock getClock() { return clock; }
  public MeterRegistry getMeterRegistry() { return meterRegistry; }
  public ObjectMapper getObjectMapper() { return objectMapper; }

  /** Publisher for the retry queue: same endpoint and collaborators, retry topology declared by the publisher. */
  public PublisherConfig retryPublisherConfig() {
    return PublisherConfig.builder(retryPolicy.retryTopology(topology))
        .endpoint(endpoint)
        .errorCallback(errorCallback)
        .transport(transport)
        .sleeper(sleeper)
        .meterRegistry(meterRegistry)
        .objectMapper(objectMapper)
        .build();
  }

  public static final class Builder {
    private final TopologyDescriptor topology;
    private EndpointIdentity endpoint;
    private boolean autoAck = true;
    private int prefetchCount = DEFAULT_PREFETCH_COUNT;
    private boolean dlkRetryEnabled;
    private String retryQueueSuffix = RetryPolicy.DEFAULT_RETRY_QUEUE_SUFFIX;
    private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
    private int backoffBase = RetryPolicy.DEFAULT_BACKOFF_BASE;
    private Long retryDelaySeconds;
    private ErrorCallback errorCallback;
    private BrokerTransport transport;
    private Sleeper sleeper;
    private Clock clock;
    private MeterRegistry meterRegistry;
    private ObjectMapper objectMapper;

    private Builder(TopologyDescriptor topology) {
      this.topology = topology;
    }

    public Builder endpoint(EndpointIdentity endpoint) { this.endpoint = endpoint; return this; }
    public Builder autoAck(boolean autoAck) { this.autoAck = autoAck; return this; }
    public Builder prefetchCount(int prefetchCount) { this.prefetchCount = prefetchCount; return this; }
    public Builder dlkRetryEnabled(boolean dlkRetryEnabled) { this.dlkRetryEnabled = dlkRetryEnabled; return this; }
    public Builder retryQueueSuffix(String retryQueueSuffix) { this.retryQueueSuffix = retryQueueSuffix; return this; }
    public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
    public Builder backoffBase(int backoffBase) { this.backoffBase = backoffBase; return this; }

    /** Unit of the retry-queue backoff; defaults to the endpoint's reconnect delay. */
    public Builder retryDelaySeconds(long retryDelaySeconds) { this.retryDelaySeconds = retryDelaySeconds; return this; }

    public Builder errorCallback(ErrorCallback errorCallback) { this.errorCallback = errorCallback; return this; }
    public Builder transport(BrokerTransport transport) { this.transport = transport; return this; }
    public Builder sleeper(Sleeper sleeper) { this.sleeper = sleeper; return this; }
    public Builder clock(Clock clock) { this.clock = clock; return this; }
    public Builder meterRegistry(MeterRegistry meterRegistry) { this.meterRegistry = meterRegistry; return this; }
    public Builder objectMapper(ObjectMapper objectMapper) { this.objectMapper = objectMapper; return this; }

    public ConsumerConfig build() {
      return new ConsumerConfig(this);
    }
  }
}
