package com.rabbitresilience.core.infrastructure.messaging;

import com.rabbitresilience.core.domain.EndpointIdentity;

/**
 * Opens connections to the broker. Failures surface as Spring AMQP {@link org.springframework.amqp.AmqpException}s;
 * {@link TransportErrors} decides which of them are worth retrying.
 */
public interface BrokerTransport {

  BrokerConnection open(EndpointIdentity endpoint);
}
