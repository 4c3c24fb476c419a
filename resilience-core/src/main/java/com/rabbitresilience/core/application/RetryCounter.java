package com.rabbitresilience.core.application;

/** Failure count of one call chain. Not thread-safe. */
public final class RetryCounter {
  private int failures;

  public int increment() {
    return ++failures;
  }

  public int get() {
    return failures;
  }
}
