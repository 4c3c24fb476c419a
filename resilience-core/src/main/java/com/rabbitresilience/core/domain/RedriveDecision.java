package com.rabbitresilience.core.domain;

import java.util.Objects;

public final class RedriveDecision {
  private static final RedriveDecision DROP = new RedriveDecision(null, 0L);

  private final MessageEnvelope envelope;
  private final long expirationMs;

  private RedriveDecision(MessageEnvelope envelope, long expirationMs) {
    this.envelope = envelope;
    this.expirationMs = expirationMs;
  }

  public static RedriveDecision drop() {
    return DROP;
  }

  public static RedriveDecision redrive(MessageEnvelope envelope, long expirationMs) {
    return new RedriveDecision(Objects.requireNonNull(envelope, "envelope"), expirationMs);
  }

  public boolean isRedrive() {
    return envelope != null;
  }

  /** Envelope with updated retry headers; only present when {@link #isRedrive()}. */
  public MessageEnvelope getEnvelope() {
    if (envelope == null) throw new IllegalStateException("A drop decision has no envelope");
    return envelope;
  }

  public long getExpirationMs() {
    return expirationMs;
  }

  @Override
  public String toString() {
    return isRedrive() ? "Redrive{expirationMs=" + expirationMs + "}" : "Drop";
  }
}
