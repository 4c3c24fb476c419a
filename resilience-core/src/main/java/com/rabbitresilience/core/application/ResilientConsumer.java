package com.rabbitresilience.core.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitresilience.core.config.ConsumerConfig;
import com.rabbitresilience.core.domain.AckDecision;
import com.rabbitresilience.core.domain.DeliveryMetadata;
import com.rabbitresilience.core.domain.ErrorType;
import com.rabbitresilience.core.domain.MessageEnvelope;
import com.rabbitresilience.core.domain.PublishOptions;
import com.rabbitresilience.core.domain.RedriveDecision;
import com.rabbitresilience.core.domain.RetryPolicy;
import com.rabbitresilience.core.domain.TopologyDescriptor;
import com.rabbitresilience.core.infrastructure.messaging.BrokerChannel;
import com.rabbitresilience.core.infrastructure.messaging.Delivery;
import com.rabbitresilience.core.infrastructure.messaging.TransportErrors;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public class ResilientConsumer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ResilientConsumer.class);
  private static final long CLOSE_JOIN_MS = 100;

  private final ConsumerConfig config;
  private final MessageCallback callback;
  private final TopologyDescriptor topology;
  private final String queue;
  private final ObjectMapper mapper;
  private final ErrorReporter reporter;
  private final ConnectionResilienceManager resilience;
  private final TopologyBinder binder = new TopologyBinder();
  private final RetryLedger ledger;
  private final ResilientPublisher retryPublisher;
  private final RetryCounter failures = new RetryCounter();
  private final Counter acked;
  private final Counter nacked;
  private final Counter redriven;
  private final Counter dropped;

  private volatile boolean stopping;
  private volatile ConsumerState state = ConsumerState.DISCONNECTED;
  private volatile BrokerSession session;
  private Thread worker;

  public ResilientConsumer(ConsumerConfig config, MessageCallback callback) {
    this.config = config;
    this.callback = callback;
    this.topology = config.getTopology();
    this.queue = topology.queueName();
    this.mapper = config.getObjectMapper();
    this.reporter = new ErrorReporter(config.getErrorCallback());
    MeterRegistry registry = config.getMeterRegistry();
    this.resilience = new ConnectionResilienceManager(config.getTransport(), config.getEndpoint(), reporter,
        config.getSleeper(), registry);
    RetryPolicy policy = config.getRetryPolicy();
    if (policy.enabled()) {
      this.ledger = new RetryLedger(policy, reporter, config.getClock());
      this.retryPublisher = new ResilientPublisher(config.retryPublisherConfig());
    } else {
      this.ledger = null;
      this.retryPublisher = null;
    }
    this.acked = registry.counter("rmq_consumer_acked_total", "queue", queue);
    this.nacked = registry.counter("rmq_consumer_nacked_total", "queue", queue);
    this.redriven = registry.counter("rmq_consumer_redriven_total", "queue", queue);
    this.dropped = registry.counter("rmq_consumer_dropped_total", "queue", queue);
  }

  /**
   * Connects and declares the topology on the calling thread, then starts consuming in the background.
   * Fatal connection errors are thrown from here.
   */
  public synchronized void start() {
    if (worker != null) throw new IllegalStateException("Consumer for " + queue + " was already started");
    if (stopping) throw new IllegalStateException("Consumer for " + queue + " is closed");
    session = connect();
    Thread thread = new Thread(this::consumeLoop, "rmq-consumer-" + queue);
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) -> {
      state = ConsumerState.FAILED;
      closeSession();
      log.error("Consumer thread {} stopped after an unrecoverable error", t.getName(), e);
    });
    worker = thread;
    thread.start();
  }

  public ConsumerState state() {
    return state;
  }

  public synchronized boolean isAlive() {
    return worker != null && worker.isAlive();
  }

  /** Asks the consume thread to cancel its subscription and waits briefly for it; does not block beyond that. */
  @Override
  public void close() {
    stopping = true;
    Thread thread;
    synchronized (this) {
      thread = worker;
    }
    if (thread == null) {
      state = ConsumerState.STOPPED;
    } else {
      try {
        thread.join(CLOSE_JOIN_MS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    if (retryPublisher != null) retryPublisher.close();
    log.info("Consumer for queue {} closed (state={})", queue, state);
  }

  private BrokerSession connect() {
    return connected(resilience.connect(failures, this::setUp));
  }

  private BrokerSession connected(BrokerSession opened) {
    state = ConsumerState.CONNECTED;
    log.info("Connected to {}:{} for queue {}", config.getEndpoint().host(), config.getEndpoint().port(), queue);
    return opened;
  }

  private void setUp(BrokerChannel channel) {
    channel.qos(config.getPrefetchCount());
    binder.declare(channel, topology);
    binder.declareRetryQueue(channel, topology, config.getRetryPolicy());
  }

  private void consumeLoop() {
    try {
      resilience.execute(failures, this::consume);
    } catch (RuntimeException e) {
      closeSession();
      if (stopping) {
        state = ConsumerState.STOPPED;
        return;
      }
      state = ConsumerState.FAILED;
      if (!TransportErrors.isRetryable(e)) {
        reporter.report("Consumer for queue " + queue + " stopped: " + e, e, ErrorType.CONNECT_ERROR);
      }
      throw e;
    }
    closeSession();
    state = ConsumerState.STOPPED;
  }

  // one subscription; a retryable failure comes back here through the reconnect policy
  private Void consume() {
    if (stopping) return null;
    if (session == null) session = connected(resilience.open(this::setUp));
    BrokerChannel channel = session.channel();
    try {
      state = ConsumerState.CONSUMING;
      channel.subscribe(queue, delivery -> handle(channel, delivery), () -> !stopping);
    } catch (RuntimeException e) {
      closeSession();
      state = ConsumerState.DISCONNECTED;
      if (stopping) return null;
      log.warn("Lost subscription on queue {}: {}", queue, e.toString());
      throw e;
    }
    return null;
  }

  private void closeSession() {
    BrokerSession current = session;
    session = null;
    if (current != null) current.close();
  }

  private void handle(BrokerChannel channel, Delivery delivery) {
    MDC.put("queue", queue);
    MDC.put("deliveryTag", Long.toString(delivery.deliveryTag()));
    try {
      dispatch(channel, delivery);
    } finally {
      MDC.remove("deliveryTag");
      MDC.remove("queue");
    }
  }

  private void dispatch(BrokerChannel channel, Delivery delivery) {
    long tag = delivery.deliveryTag();
    JsonNode payload;
    try {
      payload = decode(delivery.body());
    } catch (IOException e) {
      reporter.report("Discarding undecodable message " + tag + " from queue " + queue + ": " + e, e,
          ErrorType.CONSUME_ERROR);
      reject(channel, tag);
      return;
    }
    DeliveryMetadata metadata = new DeliveryMetadata(tag, delivery.redelivered(), delivery.exchange(),
        delivery.routingKey(), delivery.headers(), delivery.messageId(), delivery.correlationId());
    log.debug("Received message {} from {}", delivery.messageId(), queue);

    AckDecision decision;
    try {
      decision = callback.onMessage(payload, metadata);
    } catch (Exception e) {
      MessageEnvelope envelope = new MessageEnvelope(payload, delivery.headers(), delivery.messageId(),
          delivery.correlationId());
      onCallbackFailure(channel, tag, envelope, delivery.priority(), e);
      return;
    }
    settle(channel, tag, decision);
  }

  private void settle(BrokerChannel channel, long tag, AckDecision decision) {
    boolean ack = decision == AckDecision.ACK
        || (decision != AckDecision.NACK && config.isAutoAck());
    if (ack) {
      channel.ack(tag);
      acked.increment();
    } else {
      channel.nack(tag, true);
      nacked.increment();
      log.debug("Nacked delivery {} with requeue", tag);
    }
  }

  private void onCallbackFailure(BrokerChannel channel, long tag, MessageEnvelope envelope, Integer priority,
                                 Exception error) {
    log.warn("Message callback failed for delivery {} on {}: {}", tag, queue, error.toString());
    if (ledger == null) {
      reporter.consumeFailure(error, 1);
      settle(channel, tag, AckDecision.USE_DEFAULT);
      return;
    }

    RedriveDecision decision;
    try {
      decision = ledger.onFailure(envelope, error);
    } catch (IllegalStateException malformed) {
      reporter.report("Discarding message " + tag + " with unreadable retry headers: " + malformed, malformed,
          ErrorType.CONSUME_ERROR);
      reject(channel, tag);
      return;
    }
    if (!decision.isRedrive()) {
      log.warn("Giving up on message {} from {} after {} retries", envelope.getMessageId(), queue,
          ledger.policy().maxRetries());
      reject(channel, tag);
      return;
    }

    try {
      retryPublisher.publish(decision.getEnvelope(),
          new PublishOptions(priority, false, decision.getExpirationMs(), Map.of()));
    } catch (RuntimeException publishError) {
      reporter.report("Failed to redrive message " + tag + " from queue " + queue + ": " + publishError,
          publishError, ErrorType.CONSUME_ERROR);
      channel.nack(tag, true);
      nacked.increment();
      return;
    }
    redriven.increment();
    channel.ack(tag);
    acked.increment();
    log.debug("Redrove delivery {} to {} (expiration {} ms)", tag,
        ledger.policy().retryQueueName(topology), decision.getExpirationMs());
  }

  private void reject(BrokerChannel channel, long tag) {
    channel.nack(tag, false);
    nacked.increment();
    dropped.increment();
  }

  private JsonNode decode(byte[] body) throws IOException {
    String text = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT)
        .decode(ByteBuffer.wrap(body))
        .toString();
    JsonNode node = mapper.readTree(text);
    if (node == null || node.isMissingNode()) throw new IOException("Message body is empty");
    return node;
  }
}
