package com.rabbitresilience.core.domain;

import org.springframework.amqp.core.ExchangeTypes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TopologyDescriptor(String exchangeName, String exchangeType, String queueName, String routingKey,
                                 Map<String, Object> exchangeArgs, Map<String, Object> queueArgs,
                                 BoundExchange boundExchange) {

  public TopologyDescriptor {
    if (exchangeName == null || exchangeName.isBlank()) throw new IllegalArgumentException("exchangeName is required");
    exchangeType = (exchangeType == null || exchangeType.isBlank()) ? ExchangeTypes.DIRECT : exchangeType;
    queueName = queueName == null ? "" : queueName;
    routingKey = routingKey == null ? "" : routingKey;
    exchangeArgs = copy(exchangeArgs);
    queueArgs = copy(queueArgs);
  }

  /** An exchange the primary exchange is bound to (exchange-to-exchange fan-out). */
  public record BoundExchange(String name, String type) {
    public BoundExchange {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("bound exchange name is required");
      type = (type == null || type.isBlank()) ? ExchangeTypes.DIRECT : type;
    }
  }

  public boolean hasQueue() {
    return !queueName.isEmpty();
  }

  public boolean hasBoundExchange() {
    return boundExchange != null;
  }

  public static Builder builder(String exchangeName) {
    return new Builder(exchangeName);
  }

  private static Map<String, Object> copy(Map<String, Object> args) {
    if (args == null || args.isEmpty()) return Map.of();
    return Collections.unmodifiableMap(new LinkedHashMap<>(args));
  }

  public static final class Builder {
    private final String exchangeName;
    private String exchangeType = ExchangeTypes.DIRECT;
    private String queueName;
    private String routingKey;
    private Map<String, Object> exchangeArgs;
    private Map<String, Object> queueArgs;
    private BoundExchange boundExchange;

    private Builder(String exchangeName) {
      this.exchangeName = exchangeName;
    }

    public Builder exchangeType(String exchangeType) { this.exchangeType = exchangeType; return this; }
    public Builder queueName(String queueName) { this.queueName = queueName; return this; }
    public Builder routingKey(String routingKey) { this.routingKey = routingKey; return this; }
    public Builder exchangeArgs(Map<String, Object> exchangeArgs) { this.exchangeArgs = exchangeArgs; return this; }
    public Builder queueArgs(Map<String, Object> queueArgs) { this.queueArgs = queueArgs; return this; }

    public Builder boundExchange(String name, String type) {
      this.boundExchange = new BoundExchange(name, type);
      return this;
    }

    public TopologyDescriptor build() {
      return new TopologyDescriptor(exchangeName, exchangeType, queueName, routingKey, exchangeArgs, queueArgs, boundExchange);
    }
  }
}
