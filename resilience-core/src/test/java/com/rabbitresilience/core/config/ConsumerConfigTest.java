package com.rabbitresilience.core.config;

import com.rabbitresilience.core.domain.EndpointIdentity;
import com.rabbitresilience.core.domain.TopologyDescriptor;
import io.micrometer.core.instrument.Metrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConsumerConfigTest {
  private static final TopologyDescriptor ORDERS = TopologyDescriptor.builder("orders")
      .queueName("orders.created")
      .routingKey("created")
      .build();

  @Test
  void appliesDefaults() {
    var config = ConsumerConfig.builder(ORDERS).endpoint(EndpointIdentity.builder(name -> null).build()).build();

    assertThat(config.isAutoAck()).isTrue();
    assertThat(config.getPrefetchCount()).isEqualTo(1);
    assertThat(config.getRetryPolicy().enabled()).isFalse();
    assertThat(config.getRetryPolicy().maxRetries()).isEqualTo(20);
    assertThat(config.getRetryPolicy().backoffBase()).isEqualTo(2);
    assertThat(config.getRetryPolicy().retryQueueSuffix()).isEqualTo("retry");
    assertThat(config.getMeterRegistry()).isSameAs(Metrics.globalRegistry);
  }

  @Test
  void backoffUnitFollowsEndpointRetryDelay() {
    var config = ConsumerConfig.builder(ORDERS)
        .endpoint(EndpointIdentity.builder(name -> null).retryDelaySeconds(2).build())
        .build();
    assertThat(config.getRetryPolicy().retryDelaySeconds()).isEqualTo(2);
  }

  @Test
  void retryPublisherTargetsRetryQueue() {
    var config = ConsumerConfig.builder(ORDERS)
        .endpoint(EndpointIdentity.builder(name -> null).build())
        .dlkRetryEnabled(true)
        .retryQueueSuffix("later")
        .build();

    var publisher = config.retryPublisherConfig();

    assertThat(publisher.getTopology().exchangeName()).isEqualTo("orders.created.later");
    assertThat(publisher.isVerifyOnly()).isFalse();
    assertThat(publisher.getEndpoint()).isEqualTo(config.getEndpoint());
  }

  @Test
  void rejectsNegativePrefetch() {
    assertThatThrownBy(() -> ConsumerConfig.builder(ORDERS).prefetchCount(-1).build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
