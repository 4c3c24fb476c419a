package com.rabbitresilience.core.application;

import com.rabbitresilience.core.domain.MessageEnvelope;
import com.rabbitresilience.core.domain.RedriveDecision;
import com.rabbitresilience.core.domain.RetryHeaders;
import com.rabbitresilience.core.domain.RetryPolicy;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public class RetryLedger {
  private final RetryPolicy policy;
  private final BackoffCalculator backoff;
  private final ErrorReporter reporter;
  private final Clock clock;

  public RetryLedger(RetryPolicy policy, ErrorReporter reporter, Clock clock) {
    this.policy = policy;
    this.backoff = BackoffCalculator.of(policy);
    this.reporter = reporter;
    this.clock = clock;
  }

  public RedriveDecision onFailure(MessageEnvelope envelope, Throwable failure) {
    int attempt = envelope.attempt() + 1;
    reporter.consumeFailure(failure, attempt);

    if (attempt > policy.maxRetries()) {
      return RedriveDecision.drop();
    }

    long expirationMs = backoff.delayMillis(attempt);
    Instant now = clock.instant();
    String nowIso = now.toString();
    Map<String, Object> headers = new LinkedHashMap<>(envelope.getHeaders());
    headers.put(RetryHeaders.ATTEMPT, attempt);
    headers.put(RetryHeaders.MAX_ATTEMPTS, policy.maxRetries());
    headers.putIfAbsent(RetryHeaders.CREATED_AT, nowIso);
    headers.put(RetryHeaders.RETRY_REASON, String.valueOf(failure));
    headers.put(RetryHeaders.NEXT_ATTEMPT, now.plusMillis(expirationMs).toString());
    for (int i = 1; i <= attempt; i++) {
      headers.putIfAbsent(RetryHeaders.attempt(i), nowIso);
    }
    return RedriveDecision.redrive(envelope.withHeaders(headers), expirationMs);
  }

  public RetryPolicy policy() {
    return policy;
  }
}
