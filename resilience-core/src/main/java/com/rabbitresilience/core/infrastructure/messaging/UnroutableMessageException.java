package com.rabbitresilience.core.infrastructure.messaging;

import org.springframework.amqp.AmqpException;

/**
 * A mandatory publish was returned by the broker: no queue is bound for the exchange and routing key.
 * This is a topology problem and is never retried.
 */
public class UnroutableMessageException extends AmqpException {
  private final int replyCode;
  private final String replyText;
  private final String exchange;
  private final String routingKey;

  public UnroutableMessageException(int replyCode, String replyText, String exchange, String routingKey) {
    super("Message returned as unroutable: replyCode=" + replyCode + ", replyText=" + replyText
        + ", exchange=" + exchange + ", routingKey=" + routingKey);
    this.replyCode = replyCode;
    this.replyText = replyText;
    this.exchange = exchange;
    this.routingKey = routingKey;
  }

  public int getReplyCode() { return replyCode; }
  public String getReplyText() { return replyText; }
  public String getExchange() { return exchange; }
  public String getRoutingKey() { return routingKey; }
}
