package com.rabbitresilience.core.domain;

/** Header names carrying retry bookkeeping on a redriven message. */
public final class RetryHeaders {
  public static final String ATTEMPT = "x-attempt";
  public static final String MAX_ATTEMPTS = "x-max-attempts";
  public static final String CREATED_AT = "x-created-at";
  public static final String RETRY_REASON = "x-retry-reason";
  public static final String NEXT_ATTEMPT = "x-next-attempt";
  public static final String ATTEMPT_PREFIX = "x-attempt-";

  private RetryHeaders() {}

  public static String attempt(int n) {
    return ATTEMPT_PREFIX + n;
  }
}
