package com.rabbitresilience.core.application;

import com.rabbitresilience.core.domain.EndpointIdentity;
import com.rabbitresilience.core.domain.ErrorType;
import com.rabbitresilience.core.infrastructure.messaging.BrokerChannel;
import com.rabbitresilience.core.infrastructure.messaging.BrokerConnection;
import com.rabbitresilience.core.infrastructure.messaging.BrokerTransport;
import com.rabbitresilience.core.infrastructure.messaging.InMemoryBroker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.AmqpAuthenticationException;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ConnectionResilienceManagerTest {
  private final List<Long> sleeps = new ArrayList<>();
  private final List<String> reports = new ArrayList<>();
  private final Sleeper sleeper = sleeps::add;
  private final ErrorReporter reporter = new ErrorReporter((message, error, type) -> {
    assertThat(type).isEqualTo(ErrorType.CONNECT_ERROR);
    reports.add(message);
  });
  private SimpleMeterRegistry registry;
  private InMemoryBroker broker;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    broker = new InMemoryBroker();
  }

  private ConnectionResilienceManager manager(BrokerTransport transport, EndpointIdentity endpoint) {
    return new ConnectionResilienceManager(transport, endpoint, reporter, sleeper, registry);
  }

  private static EndpointIdentity endpoint(int attempts, boolean infinite) {
    return EndpointIdentity.builder(name -> null)
        .connectionAttempts(attempts)
        .retryDelay(Duration.ofSeconds(5))
        .infiniteRetry(infinite)
        .build();
  }

  @Test
  void permanentFailureSleepsTwiceThenGivesUpAfterThreeAttempts() {
    broker.refuseConnections(Integer.MAX_VALUE);
    var manager = manager(broker, endpoint(3, false));

    assertThatThrownBy(() -> manager.connect(new RetryCounter(), channel -> {}))
        .isInstanceOf(AmqpConnectException.class);

    assertThat(sleeps).containsExactly(5_000L, 5_000L);
    assertThat(reports).singleElement().asString()
        .startsWith("Service tried to reconnect to queue **3** times but still failed.");
    assertThat(registry.counter("rmq_reconnect_failures_total").count()).isEqualTo(1.0d);
  }

  @Test
  void recoversBeforeTheAttemptBudgetIsSpent() {
    broker.refuseConnections(2);
    var manager = manager(broker, endpoint(3, false));

    BrokerSession session = manager.connect(new RetryCounter(), channel -> channel.qos(1));

    assertThat(session.channel().isOpen()).isTrue();
    assertThat(sleeps).hasSize(2);
    assertThat(reports).isEmpty();
  }

  @Test
  void infiniteRetryReportsAtEveryMultipleAndKeepsGoing() {
    broker.refuseConnections(7);
    var manager = manager(broker, endpoint(3, true));
    var counter = new RetryCounter();

    manager.connect(counter, channel -> {});

    assertThat(counter.get()).isEqualTo(7);
    assertThat(sleeps).hasSize(7);
    assertThat(reports).hasSize(2);
    assertThat(reports.get(0)).contains("**3**");
    assertThat(reports.get(1)).contains("**6**");
  }

  @Test
  void sharedCounterOnlyGrantsTheRestOfTheBudget() {
    var manager = manager(broker, endpoint(3, false));
    var counter = new RetryCounter();
    broker.refuseConnections(2);
    manager.connect(counter, channel -> {});
    sleeps.clear();

    broker.refuseConnections(Integer.MAX_VALUE);
    assertThatThrownBy(() -> manager.connect(counter, channel -> {}))
        .isInstanceOf(AmqpConnectException.class);

    assertThat(counter.get()).isEqualTo(3);
    assertThat(sleeps).isEmpty();
    assertThat(reports).singleElement().asString().contains("**3**");
  }

  @Test
  void nonRetryableErrorPropagatesWithoutSleeping() {
    broker.refuseConnections(1, new AmqpAuthenticationException(new RuntimeException("ACCESS_REFUSED")));
    var manager = manager(broker, endpoint(3, false));

    assertThatThrownBy(() -> manager.connect(new RetryCounter(), channel -> {}))
        .isInstanceOf(AmqpAuthenticationException.class);
    assertThat(sleeps).isEmpty();
    assertThat(reports).isEmpty();
  }

  @Test
  void failingSetupClosesTheConnection() {
    BrokerTransport transport = mock(BrokerTransport.class);
    BrokerConnection connection = mock(BrokerConnection.class);
    BrokerChannel channel = mock(BrokerChannel.class);
    when(transport.open(any())).thenReturn(connection);
    when(connection.openChannel()).thenReturn(channel);
    var manager = manager(transport, endpoint(3, false));

    assertThatThrownBy(() -> manager.connect(new RetryCounter(), c -> {
      throw new IllegalArgumentException("bad topology");
    })).isInstanceOf(IllegalArgumentException.class);
    verify(connection).close();
  }

  @Test
  void throwingErrorCallbackDoesNotMaskTheFailure() {
    broker.refuseConnections(Integer.MAX_VALUE);
    var noisy = new ErrorReporter((message, error, type) -> {
      throw new IllegalStateException("callback broke");
    });
    var manager = new ConnectionResilienceManager(broker, endpoint(1, false), noisy, sleeper, registry);

    assertThatThrownBy(() -> manager.openConnection())
        .isInstanceOf(AmqpConnectException.class);
    assertThatThrownBy(() -> manager.execute(new RetryCounter(), manager::openConnection))
        .isInstanceOf(AmqpConnectException.class)
        .hasRootCauseInstanceOf(ConnectException.class);
  }

  @Test
  void interruptedSleepRethrowsAndKeepsTheFlag() {
    broker.refuseConnections(Integer.MAX_VALUE);
    Sleeper interrupted = millis -> {
      throw new InterruptedException("stop");
    };
    var manager = new ConnectionResilienceManager(broker, endpoint(3, false), reporter, interrupted, registry);

    try {
      assertThatThrownBy(() -> manager.connect(new RetryCounter(), channel -> {}))
          .isInstanceOf(AmqpConnectException.class)
          .satisfies(e -> assertThat(e.getSuppressed()).hasAtLeastOneElementOfType(BackOffInterruptedException.class));
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }
}
