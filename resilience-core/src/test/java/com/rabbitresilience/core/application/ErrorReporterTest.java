package com.rabbitresilience.core.application;

import com.rabbitresilience.core.domain.ErrorType;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class ErrorReporterTest {

  @Test
  void consumeFailureCarriesCountAndError() {
    ErrorCallback callback = mock(ErrorCallback.class);
    var error = new IllegalStateException("db down");

    new ErrorReporter(callback).consumeFailure(error, 2);

    var message = ArgumentCaptor.forClass(String.class);
    verify(callback).onError(message.capture(), eq(error), eq(ErrorType.CONSUME_ERROR));
    assertThat(message.getValue())
        .isEqualTo("Service tried to consume message **2** times but still failed.\n" + error);
  }

  @Test
  void failingCallbackIsSwallowed() {
    ErrorCallback callback = mock(ErrorCallback.class);
    doThrow(new RuntimeException("alerting down")).when(callback).onError(any(), any(), any());

    assertThatCode(() -> new ErrorReporter(callback).reconnectFailure(new RuntimeException("refused"), 3))
        .doesNotThrowAnyException();
  }

  @Test
  void withoutCallbackOnlyLogs() {
    assertThatCode(() -> new ErrorReporter(null).report("x", new RuntimeException(), ErrorType.CONNECT_ERROR))
        .doesNotThrowAnyException();
  }
}
