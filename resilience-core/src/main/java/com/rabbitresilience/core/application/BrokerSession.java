package com.rabbitresilience.core.application;

import com.rabbitresilience.core.infrastructure.messaging.BrokerChannel;
import com.rabbitresilience.core.infrastructure.messaging.BrokerConnection;

public record BrokerSession(BrokerConnection connection, BrokerChannel channel) {

  public void close() {
    channel.close();
    connection.close();
  }
}
