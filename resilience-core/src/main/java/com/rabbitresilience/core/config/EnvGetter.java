package com.rabbitresilience.core.config;

/**
 * Reads environment variables through an indirection so tests can supply their own values.
 */
@FunctionalInterface
public interface EnvGetter {
  EnvGetter system = System::getenv;

  String RABBITMQ_HOST = "RABBITMQ_HOST";
  String RABBITMQ_PORT = "RABBITMQ_PORT";

  /** Returns the raw value, or {@code null} if unset. */
  String get(String name);

  static String getStringOr(EnvGetter env, String name, String defaultValue) {
    String value = env.get(name);
    return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
  }

  static int getIntOr(EnvGetter env, String name, int defaultValue) {
    String value = env.get(name);
    if (value == null || value.isBlank()) return defaultValue;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Invalid integer for environment variable: " + name + " = '" + value + "'", e);
    }
  }
}
