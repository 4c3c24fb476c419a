package com.rabbitresilience.core.application;

/** Lifecycle of a {@link ResilientConsumer}. */
public enum ConsumerState {
  DISCONNECTED,
  CONNECTED,
  CONSUMING,
  /** Closed by the caller. */
  STOPPED,
  /** The consume thread ended on an unrecoverable error. */
  FAILED
}
