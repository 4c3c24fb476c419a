package com.rabbitresilience.core.infrastructure.messaging;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitresilience.core.domain.EndpointIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

public class AmqpBrokerTransport implements BrokerTransport {
  private static final Logger log = LoggerFactory.getLogger(AmqpBrokerTransport.class);

  public static final Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofSeconds(10);

  private final String connectionName;
  private final Duration confirmTimeout;

  public AmqpBrokerTransport() {
    this("rabbit-resilience", DEFAULT_CONFIRM_TIMEOUT);
  }

  public AmqpBrokerTransport(String connectionName, Duration confirmTimeout) {
    this.connectionName = connectionName;
    this.confirmTimeout = confirmTimeout;
  }

  @Override
  public BrokerConnection open(EndpointIdentity endpoint) {
    ConnectionFactory factory = connectionFactory(endpoint);
    try {
      Connection connection = factory.newConnection(connectionName);
      log.info("Connected to RabbitMQ at {}:{} as {}", endpoint.host(), endpoint.port(), endpoint.username());
      return new AmqpBrokerConnection(connection, confirmTimeout);
    } catch (IOException | TimeoutException e) {
      throw TransportErrors.translate(e);
    }
  }

  protected ConnectionFactory connectionFactory(EndpointIdentity endpoint) {
    ConnectionFactory factory = new ConnectionFactory();
    factory.setHost(endpoint.host());
    factory.setPort(endpoint.port());
    factory.setUsername(endpoint.username());
    factory.setPassword(endpoint.password());
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    return factory;
  }
}
