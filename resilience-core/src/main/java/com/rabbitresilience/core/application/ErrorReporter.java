package com.rabbitresilience.core.application;

import com.rabbitresilience.core.domain.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ErrorReporter {
  private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

  private final ErrorCallback callback;

  public ErrorReporter(ErrorCallback callback) {
    this.callback = callback;
  }

  public void report(String message, Throwable error, ErrorType type) {
    if (callback == null) {
      log.error("{} [{}]", message, type, error);
      return;
    }
    try {
      callback.onError(message, error, type);
    } catch (RuntimeException callbackError) {
      log.error("Error callback failed while reporting {}: {}", type, message, callbackError);
    }
  }

  public void reconnectFailure(Throwable error, int retryCount) {
    report("Service tried to reconnect to queue **" + retryCount + "** times but still failed.\n" + error,
        error, ErrorType.CONNECT_ERROR);
  }

  public void consumeFailure(Throwable error, int retryCount) {
    report("Service tried to consume message **" + retryCount + "** times but still failed.\n" + error,
        error, ErrorType.CONSUME_ERROR);
  }
}
