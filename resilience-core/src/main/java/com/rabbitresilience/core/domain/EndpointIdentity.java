package com.rabbitresilience.core.domain;

import com.rabbitresilience.core.config.EnvGetter;

import java.time.Duration;
import java.util.Objects;

/**
 * Where and how to reach the broker, plus the reconnect budget shared by every attempt.
 *
 * @param connectionAttempts failures tolerated before a reconnection failure is escalated
 * @param retryDelay pause between two reconnect attempts
 * @param infiniteRetry keep retrying after escalation instead of failing
 */
public record EndpointIdentity(String host, int port, String username, String password,
                               int connectionAttempts, Duration retryDelay, boolean infiniteRetry) {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5672;
  public static final String DEFAULT_USERNAME = "guest";
  public static final String DEFAULT_PASSWORD = "guest";
  public static final int DEFAULT_CONNECTION_ATTEMPTS = 3;
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);

  public EndpointIdentity {
    if (host == null || host.isBlank()) throw new IllegalArgumentException("host is required");
    if (port < 1 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    if (connectionAttempts < 1) throw new IllegalArgumentException("connectionAttempts must be >= 1");
    Objects.requireNonNull(retryDelay, "retryDelay");
    if (retryDelay.isNegative()) throw new IllegalArgumentException("retryDelay must not be negative");
  }

  public static Builder builder() {
    return new Builder(EnvGetter.system);
  }

  /** Host and port default to {@code RABBITMQ_HOST} / {@code RABBITMQ_PORT} read from {@code env}. */
  public static Builder builder(EnvGetter env) {
    return new Builder(env);
  }

  @Override
  public String toString() {
    // password left out on purpose
    return "EndpointIdentity[" + username + "@" + host + ":" + port
        + ", connectionAttempts=" + connectionAttempts + ", retryDelay=" + retryDelay
        + ", infiniteRetry=" + infiniteRetry + "]";
  }

  public static final class Builder {
    private final EnvGetter env;
    private String host;
    private Integer port;
    private String username = DEFAULT_USERNAME;
    private String password = DEFAULT_PASSWORD;
    private int connectionAttempts = DEFAULT_CONNECTION_ATTEMPTS;
    private Duration retryDelay = DEFAULT_RETRY_DELAY;
    private boolean infiniteRetry;

    private Builder(EnvGetter env) {
      this.env = Objects.requireNonNull(env, "env");
    }

    public Builder host(String host) { this.host = host; return this; }
    public Builder port(int port) { this.port = port; return this; }
    public Builder username(String username) { this.username = username; return this; }
    public Builder password(String password) { this.password = password; return this; }
    public Builder connectionAttempts(int connectionAttempts) { this.connectionAttempts = connectionAttempts; return this; }
    public Builder retryDelay(Duration retryDelay) { this.retryDelay = retryDelay; return this; }
    public Builder retryDelaySeconds(long seconds) { this.retryDelay = Duration.ofSeconds(seconds); return this; }
    public Builder infiniteRetry(boolean infiniteRetry) { this.infiniteRetry = infiniteRetry; return this; }

    public EndpointIdentity build() {
      String h = (host != null && !host.isBlank()) ? host : EnvGetter.getStringOr(env, EnvGetter.RABBITMQ_HOST, DEFAULT_HOST);
      int p = port != null ? port : EnvGetter.getIntOr(env, EnvGetter.RABBITMQ_PORT, DEFAULT_PORT);
      return new EndpointIdentity(h, p, username, password, connectionAttempts, retryDelay, infiniteRetry);
    }
  }
}
