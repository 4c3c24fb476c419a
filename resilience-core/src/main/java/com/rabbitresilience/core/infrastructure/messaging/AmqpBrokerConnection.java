package com.rabbitresilience.core.infrastructure.messaging;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpResourceNotAvailableException;

import java.io.IOException;
import java.time.Duration;

class AmqpBrokerConnection implements BrokerConnection {
  private static final Logger log = LoggerFactory.getLogger(AmqpBrokerConnection.class);

  private final Connection connection;
  private final Duration confirmTimeout;

  AmqpBrokerConnection(Connection connection, Duration confirmTimeout) {
    this.connection = connection;
    this.confirmTimeout = confirmTimeout;
  }

  @Override
  public BrokerChannel openChannel() {
    try {
      Channel channel = connection.createChannel();
      if (channel == null) {
        throw new AmqpResourceNotAvailableException("The channelMax limit is reached on " + connection);
      }
      return new AmqpBrokerChannel(channel, confirmTimeout);
    } catch (IOException | ShutdownSignalException e) {
      throw TransportErrors.translate(e);
    }
  }

  @Override
  public boolean isOpen() {
    return connection.isOpen();
  }

  @Override
  public void close() {
    if (!connection.isOpen()) return;
    try {
      connection.close();
    } catch (IOException | ShutdownSignalException e) {
      // already going down on the broker side
      log.debug("Ignoring error while closing connection {}", connection, e);
    }
  }
}
