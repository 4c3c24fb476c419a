package com.rabbitresilience.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitresilience.core.application.ErrorCallback;
import com.rabbitresilience.core.domain.EndpointIdentity;
import com.rabbitresilience.core.domain.TopologyDescriptor;
import com.rabbitresilience.core.infrastructure.messaging.AmqpBrokerTransport;
import com.rabbitresilience.core.infrastructure.messaging.BrokerTransport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.util.Objects;

public final class PublisherConfig {
  private final EndpointIdentity endpoint;
  private final TopologyDescriptor topology;
  private final boolean verifyOnly;
  private final ErrorCallback errorCallback;
  private final BrokerTransport transport;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;
  private final ObjectMapper objectMapper;

  private PublisherConfig(Builder b) {
    this.endpoint = b.endpoint != null ? b.endpoint : EndpointIdentity.builder().build();
    this.topology = Objects.requireNonNull(b.topology, "topology");
    this.verifyOnly = b.verifyOnly;
    this.errorCallback = b.errorCallback;
    this.transport = b.transport != null ? b.transport : new AmqpBrokerTransport();
    this.sleeper = b.sleeper != null ? b.sleeper : new ThreadWaitSleeper();
    this.meterRegistry = b.meterRegistry != null ? b.meterRegistry : Metrics.globalRegistry;
    this.objectMapper = b.objectMapper != null ? b.objectMapper : new ObjectMapper();
    if (!verifyOnly && (!topology.hasQueue() || topology.routingKey().isEmpty())) {
      throw new IllegalArgumentException("queueName and routingKey are required unless the publisher is verify-only");
    }
  }

  public static Builder builder(TopologyDescriptor topology) {
    return new Builder(topology);
  }

  public EndpointIdentity getEndpoint() { return endpoint; }
  public TopologyDescriptor getTopology() { return topology; }
  public boolean isVerifyOnly() { return verifyOnly; }
  public ErrorCallback getErrorCallback() { return errorCallback; }
  public BrokerTransport getTransport() { return transport; }
  public Sleeper getSleeper() { return sleeper; }
  public MeterRegistry getMeterRegistry() { return meterRegistry; }
  public ObjectMapper getObjectMapper() { return objectMapper; }

  public static final class Builder {
    private final TopologyDescriptor topology;
    private EndpointIdentity endpoint;
    private boolean verifyOnly;
    private ErrorCallback errorCallback;
    private BrokerTransport transport;
    private Sleeper sleeper;
    private MeterRegistry meterRegistry;
    private ObjectMapper objectMapper;

    private Builder(TopologyDescriptor topology) {
      this.topology = topology;
    }

    public Builder endpoint(EndpointIdentity endpoint) { this.endpoint = endpoint; return this; }

    /** Check that the exchange exists instead of declaring exchange, queue and binding. */
    public Builder verifyOnly(boolean verifyOnly) { this.verifyOnly = verifyOnly; return this; }

    public Builder errorCallback(ErrorCallback errorCallback) { this.errorCallback = errorCallback; return this; }
    public Builder transport(BrokerTransport transport) { this.transport = transport; return this; }
    public Builder sleeper(Sleeper sleeper) { this.sleeper = sleeper; return this; }
    public Builder meterRegistry(MeterRegistry meterRegistry) { this.meterRegistry = meterRegistry; return this; }
    public Builder objectMapper(ObjectMapper objectMapper) { this.objectMapper = objectMapper; return this; }

    public PublisherConfig build() {
      return new PublisherConfig(this);
    }
  }
}
