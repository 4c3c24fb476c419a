package com.rabbitresilience.core.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EndpointIdentityTest {

  @Test
  void defaultsWhenEnvironmentIsEmpty() {
    EndpointIdentity endpoint = EndpointIdentity.builder(name -> null).build();
    assertEquals("localhost", endpoint.host());
    assertEquals(5672, endpoint.port());
    assertEquals(3, endpoint.connectionAttempts());
    assertEquals(Duration.ofSeconds(5), endpoint.retryDelay());
    assertFalse(endpoint.infiniteRetry());
  }

  @Test
  void hostAndPortComeFromEnvironment() {
    Map<String, String> env = Map.of("RABBITMQ_HOST", "rabbit.internal", "RABBITMQ_PORT", "5673");
    EndpointIdentity endpoint = EndpointIdentity.builder(env::get).build();
    assertEquals("rabbit.internal", endpoint.host());
    assertEquals(5673, endpoint.port());
  }

  @Test
  void explicitValuesWinOverEnvironment() {
    Map<String, String> env = Map.of("RABBITMQ_HOST", "rabbit.internal", "RABBITMQ_PORT", "5673");
    EndpointIdentity endpoint = EndpointIdentity.builder(env::get).host("10.0.0.5").port(15672).build();
    assertEquals("10.0.0.5", endpoint.host());
    assertEquals(15672, endpoint.port());
  }

  @Test
  void invalidPortInEnvironmentIsRejected() {
    assertThrows(IllegalStateException.class,
        () -> EndpointIdentity.builder(Map.of("RABBITMQ_PORT", "amqp")::get).build());
  }

  @Test
  void rejectsZeroConnectionAttempts() {
    assertThrows(IllegalArgumentException.class,
        () -> EndpointIdentity.builder(name -> null).connectionAttempts(0).build());
  }

  @Test
  void toStringHidesPassword() {
    EndpointIdentity endpoint = EndpointIdentity.builder(name -> null).password("s3cret").build();
    assertFalse(endpoint.toString().contains("s3cret"));
  }
}
