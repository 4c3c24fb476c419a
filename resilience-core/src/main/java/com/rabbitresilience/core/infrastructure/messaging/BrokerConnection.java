package com.rabbitresilience.core.infrastructure.messaging;

/** A live connection; channels opened on it share its socket. */
public interface BrokerConnection extends AutoCloseable {

  BrokerChannel openChannel();

  boolean isOpen();

  /** Closes the connection and its channels, ignoring errors from an already broken connection. */
  @Override
  void close();
}
