package com.rabbitresilience.core.infrastructure.messaging;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import org.springframework.amqp.AmqpAuthenticationException;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.AmqpTimeoutException;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;

import java.util.Set;

/**
 * Splits transport failures into retryable ones (connection refused/reset, channel or connection closed by the
 * broker, stream lost, timeouts) and fatal ones (authentication, access refused, missing or conflicting
 * topology, unroutable publishes, anything unclassified).
 */
public final class TransportErrors {
  private static final Set<Integer> STRUCTURAL_CHANNEL_CODES =
      Set.of(AMQP.ACCESS_REFUSED, AMQP.NOT_FOUND, AMQP.PRECONDITION_FAILED);
  private static final Set<Integer> FATAL_CONNECTION_CODES = Set.of(AMQP.ACCESS_REFUSED, AMQP.NOT_ALLOWED);

  private TransportErrors() {}

  /** Converts a checked RabbitMQ client exception into Spring AMQP's unchecked hierarchy. */
  public static RuntimeException translate(Throwable error) {
    return RabbitExceptionTranslator.convertRabbitAccessException(error);
  }

  public static boolean isRetryable(Throwable error) {
    if (error == null || error instanceof UnroutableMessageException || error instanceof AmqpAuthenticationException) {
      return false;
    }
    if (!(error instanceof AmqpConnectException
        || error instanceof AmqpIOException
        || error instanceof AmqpTimeoutException)) {
      return false;
    }
    ShutdownSignalException signal = findShutdownSignal(error);
    if (signal == null) return true;
    Method reason = signal.getReason();
    if (reason instanceof AMQP.Channel.Close close) {
      return !STRUCTURAL_CHANNEL_CODES.contains(close.getReplyCode());
    }
    if (reason instanceof AMQP.Connection.Close close) {
      return !FATAL_CONNECTION_CODES.contains(close.getReplyCode());
    }
    return true;
  }

  /** Reply code of the channel or connection close behind {@code error}, or -1 when there is none. */
  public static int replyCode(Throwable error) {
    ShutdownSignalException signal = findShutdownSignal(error);
    if (signal == null) return -1;
    Method reason = signal.getReason();
    if (reason instanceof AMQP.Channel.Close close) return close.getReplyCode();
    if (reason instanceof AMQP.Connection.Close close) return close.getReplyCode();
    return -1;
  }

  static ShutdownSignalException findShutdownSignal(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth++ < 10) {
      if (current instanceof ShutdownSignalException sse) return sse;
      current = current.getCause();
    }
    return null;
  }
}
