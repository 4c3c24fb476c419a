package com.rabbitresilience.core.application;

import com.rabbitresilience.core.domain.EndpointIdentity;
import com.rabbitresilience.core.infrastructure.messaging.BrokerChannel;
import com.rabbitresilience.core.infrastructure.messaging.BrokerConnection;
import com.rabbitresilience.core.infrastructure.messaging.BrokerTransport;
import com.rabbitresilience.core.infrastructure.messaging.TransportErrors;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.classify.BinaryExceptionClassifier;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/** Runs broker work under the endpoint's reconnect policy. */
public class ConnectionResilienceManager {
  private static final Logger log = LoggerFactory.getLogger(ConnectionResilienceManager.class);

  private static final BinaryExceptionClassifier RETRYABLE = new BinaryExceptionClassifier(false) {
    @Override
    public Boolean classify(Throwable error) {
      return TransportErrors.isRetryable(error);
    }
  };

  private final BrokerTransport transport;
  private final EndpointIdentity endpoint;
  private final ErrorReporter reporter;
  private final FixedBackOffPolicy backOff = new FixedBackOffPolicy();
  private final Counter reconnectFailures;

  public ConnectionResilienceManager(BrokerTransport transport, EndpointIdentity endpoint, ErrorReporter reporter,
                                     Sleeper sleeper, MeterRegistry registry) {
    this.transport = transport;
    this.endpoint = endpoint;
    this.reporter = reporter;
    this.backOff.setBackOffPeriod(endpoint.retryDelay().toMillis());
    this.backOff.setSleeper(sleeper);
    this.reconnectFailures = registry.counter("rmq_reconnect_failures_total");
  }

  /**
   * Runs {@code work} until it succeeds, fails with a non-retryable error, or the shared {@code counter} hits the
   * next {@code connectionAttempts} multiple without {@code infiniteRetry}. The counter is never reset, so a
   * consumer that already failed twice out of three attempts has one attempt left.
   */
  public <T> T execute(RetryCounter counter, Supplier<T> work) {
    AtomicReference<RuntimeException> last = new AtomicReference<>();
    RetryTemplate template = new RetryTemplate();
    template.setRetryPolicy(new SimpleRetryPolicy(attemptsLeft(counter), RETRYABLE));
    template.setBackOffPolicy(backOff);
    template.registerListener(escalation(counter, last));
    try {
      return template.execute((RetryCallback<T, RuntimeException>) context -> work.get());
    } catch (BackOffInterruptedException interrupted) {
      RuntimeException error = last.get();
      if (error == null) throw interrupted;
      error.addSuppressed(interrupted);
      throw error;
    }
  }

  /**
   * Opens a connection and a channel and runs {@code setup} (QoS, topology) on the channel, retrying the
   * whole sequence on transient failures.
   */
  public BrokerSession connect(RetryCounter counter, Consumer<BrokerChannel> setup) {
    return execute(counter, () -> open(setup));
  }

  /** One connect attempt; a half-open connection is closed before the failure propagates. */
  public BrokerSession open(Consumer<BrokerChannel> setup) {
    BrokerConnection connection = transport.open(endpoint);
    try {
      BrokerChannel channel = connection.openChannel();
      setup.accept(channel);
      return new BrokerSession(connection, channel);
    } catch (RuntimeException e) {
      connection.close();
      throw e;
    }
  }

  public BrokerConnection openConnection() {
    return transport.open(endpoint);
  }

  public EndpointIdentity endpoint() {
    return endpoint;
  }

  private int attemptsLeft(RetryCounter counter) {
    if (endpoint.infiniteRetry()) return Integer.MAX_VALUE;
    return endpoint.connectionAttempts() - counter.get() % endpoint.connectionAttempts();
  }

  private RetryListener escalation(RetryCounter counter, AtomicReference<RuntimeException> last) {
    return new RetryListener() {
      @Override
      public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                   Throwable throwable) {
        if (!(throwable instanceof RuntimeException error) || !TransportErrors.isRetryable(error)) return;
        last.set(error);
        int failures = counter.increment();
        log.warn("Broker failure #{} against {}:{}: {}", failures, endpoint.host(), endpoint.port(),
            error.toString());
        if (failures % endpoint.connectionAttempts() != 0) return;
        reconnectFailures.increment();
        reporter.reconnectFailure(error, failures);
        if (!endpoint.infiniteRetry()) {
          log.error("Giving up after {} failures against {}:{}", failures, endpoint.host(), endpoint.port());
        }
      }
    };
  }
}
