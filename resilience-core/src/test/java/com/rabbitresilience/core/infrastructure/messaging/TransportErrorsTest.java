package com.rabbitresilience.core.infrastructure.messaging;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.ShutdownSignalException;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.AmqpAuthenticationException;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.AmqpTimeoutException;
import org.springframework.amqp.UncategorizedAmqpException;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

public class TransportErrorsTest {

  private static ShutdownSignalException channelClose(int code) {
    return new ShutdownSignalException(false, false,
        new AMQP.Channel.Close.Builder().replyCode(code).replyText("closed " + code).build(), null);
  }

  private static ShutdownSignalException connectionClose(int code) {
    return new ShutdownSignalException(true, false,
        new AMQP.Connection.Close.Builder().replyCode(code).replyText("closed " + code).build(), null);
  }

  @Test
  void refusedConnectionIsRetryable() {
    var error = TransportErrors.translate(new ConnectException("Connection refused"));
    assertThat(error).isInstanceOf(AmqpConnectException.class);
    assertThat(TransportErrors.isRetryable(error)).isTrue();
  }

  @Test
  void brokenStreamAndTimeoutsAreRetryable() {
    assertThat(TransportErrors.isRetryable(new AmqpIOException(new IOException("Connection reset")))).isTrue();
    assertThat(TransportErrors.isRetryable(TransportErrors.translate(new TimeoutException("confirm")))).isTrue();
    assertThat(TransportErrors.isRetryable(new AmqpTimeoutException("slow"))).isTrue();
  }

  @Test
  void forcedConnectionCloseIsRetryable() {
    var error = TransportErrors.translate(connectionClose(AMQP.CONNECTION_FORCED));
    assertThat(TransportErrors.isRetryable(error)).isTrue();
    assertThat(TransportErrors.replyCode(error)).isEqualTo(AMQP.CONNECTION_FORCED);
  }

  @Test
  void structuralChannelErrorsAreFatal() {
    for (int code : new int[] {AMQP.ACCESS_REFUSED, AMQP.NOT_FOUND, AMQP.PRECONDITION_FAILED}) {
      var error = new AmqpIOException(new IOException("channel error", channelClose(code)));
      assertThat(TransportErrors.isRetryable(error)).as("reply code %d", code).isFalse();
      assertThat(TransportErrors.replyCode(error)).isEqualTo(code);
    }
  }

  @Test
  void otherChannelClosesAreRetryable() {
    var error = new AmqpIOException(new IOException("channel error", channelClose(AMQP.INTERNAL_ERROR)));
    assertThat(TransportErrors.isRetryable(error)).isTrue();
  }

  @Test
  void accessRefusedOnConnectionIsFatal() {
    var error = TransportErrors.translate(connectionClose(AMQP.ACCESS_REFUSED));
    assertThat(TransportErrors.isRetryable(error)).isFalse();
  }

  @Test
  void unroutableAuthenticationAndUnknownErrorsAreFatal() {
    assertThat(TransportErrors.isRetryable(new UnroutableMessageException(312, "NO_ROUTE", "x", "rk"))).isFalse();
    assertThat(TransportErrors.isRetryable(new AmqpAuthenticationException(new RuntimeException()))).isFalse();
    assertThat(TransportErrors.isRetryable(new UncategorizedAmqpException(new RuntimeException()))).isFalse();
    assertThat(TransportErrors.isRetryable(new IllegalArgumentException())).isFalse();
    assertThat(TransportErrors.isRetryable(null)).isFalse();
  }

  @Test
  void replyCodeIsMinusOneWithoutShutdownSignal() {
    assertThat(TransportErrors.replyCode(new AmqpIOException(new IOException("reset")))).isEqualTo(-1);
  }
}
