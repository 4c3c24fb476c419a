package com.rabbitresilience.core.application;

import com.rabbitresilience.core.domain.ErrorType;

/**
 * Hook for reporting failures the engine absorbs (reconnect escalations, consume failures).
 * Exceptions thrown from it are logged and ignored.
 */
@FunctionalInterface
public interface ErrorCallback {

  void onError(String message, Throwable error, ErrorType errorType);
}
