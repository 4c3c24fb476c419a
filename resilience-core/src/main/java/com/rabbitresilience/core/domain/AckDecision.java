package com.rabbitresilience.core.domain;

/** What a message callback asks the consumer to do with the delivery it just handled. */
public enum AckDecision {
  /** Acknowledge: the broker drops the message. */
  ACK,
  /** Negative acknowledgement with requeue: the broker redelivers. */
  NACK,
  /** Apply the consumer's configured {@code autoAck} default. */
  USE_DEFAULT
}
