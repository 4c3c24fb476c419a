package com.rabbitresilience.core.application;

import com.rabbitresilience.core.domain.RetryPolicy;
import com.rabbitresilience.core.domain.TopologyDescriptor;
import com.rabbitresilience.core.infrastructure.messaging.BrokerChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TopologyBinder {
  private static final Logger log = LoggerFactory.getLogger(TopologyBinder.class);

  public void declare(BrokerChannel channel, TopologyDescriptor topology) {
    channel.declareExchange(topology.exchangeName(), topology.exchangeType(), true, topology.exchangeArgs());
    if (topology.hasQueue()) {
      channel.declareQueue(topology.queueName(), true, topology.queueArgs());
      channel.bindQueue(topology.queueName(), topology.exchangeName(), topology.routingKey(), topology.queueArgs());
    }
    if (topology.hasBoundExchange()) {
      TopologyDescriptor.BoundExchange bound = topology.boundExchange();
      channel.declareExchange(bound.name(), bound.type(), true, null);
      channel.bindExchange(topology.exchangeName(), bound.name(), topology.routingKey(), topology.exchangeArgs());
    }
    log.debug("Declared exchange={} ({}), queue={}, routingKey={}, boundExchange={}",
        topology.exchangeName(), topology.exchangeType(), topology.queueName(), topology.routingKey(),
        topology.boundExchange());
  }

  /** Declares {@code <queue>.<suffix>}, dead-lettering back to the primary exchange. No-op when retry is off. */
  public void declareRetryQueue(BrokerChannel channel, TopologyDescriptor primary, RetryPolicy policy) {
    if (!policy.enabled()) return;
    declare(channel, policy.retryTopology(primary));
  }

  /** Passive check of the exchange only; a missing queue or binding shows up later as an unroutable publish. */
  public void verify(BrokerChannel channel, TopologyDescriptor topology) {
    channel.checkExchange(topology.exchangeName());
    log.debug("Verified exchange {} exists", topology.exchangeName());
  }
}
