package com.rabbitresilience.core.domain;

/** Phase in which a reported error happened. */
public enum ErrorType {
  CONNECT_ERROR,
  CONSUME_ERROR
}
