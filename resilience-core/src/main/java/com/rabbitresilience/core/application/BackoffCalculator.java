package com.rabbitresilience.core.application;

import com.rabbitresilience.core.domain.RetryPolicy;

/** {@code delay(attempt) = backoffBase^(attempt-1) * retryDelaySeconds * 1000} milliseconds. */
public final class BackoffCalculator {
  private final int backoffBase;
  private final long retryDelaySeconds;

  public BackoffCalculator(int backoffBase, long retryDelaySeconds) {
    if (backoffBase < 1) throw new IllegalArgumentException("backoffBase must be >= 1");
    if (retryDelaySeconds < 0) throw new IllegalArgumentException("retryDelaySeconds must not be negative");
    this.backoffBase = backoffBase;
    this.retryDelaySeconds = retryDelaySeconds;
  }

  public static BackoffCalculator of(RetryPolicy policy) {
    return new BackoffCalculator(policy.backoffBase(), policy.retryDelaySeconds());
  }

  public long delayMillis(int attempt) {
    if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1: " + attempt);
    long delay = retryDelaySeconds * 1000L;
    for (int i = 1; i < attempt; i++) {
      if (delay > Long.MAX_VALUE / backoffBase) return Long.MAX_VALUE;
      delay *= backoffBase;
    }
    return delay;
  }
}
