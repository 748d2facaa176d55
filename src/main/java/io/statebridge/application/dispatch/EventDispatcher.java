package io.statebridge.application.dispatch;

import io.statebridge.application.port.MetricsPort;
import io.statebridge.application.port.StateSerializer;
import io.statebridge.application.port.TopicPublisher;
import io.statebridge.domain.entity.EntityId;
import io.statebridge.domain.entity.StateChangeEvent;
import io.statebridge.logging.Logs;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans one state-change event out to every topic whose effective filter accepts it.
 *
 * <p>The payload is serialized at most once per event and the same bytes go to every matching
 * topic. Each topic's publish attempt is isolated: a publisher exception or a failed delivery is
 * logged and counted for that topic only and never stops the remaining topics. The dispatcher does
 * not retry.</p>
 * <p>Stateless over an immutable {@link TopicRouter}; safe to call from many worker threads.</p>
 *
 * @since 0.1.0
 */
public final class EventDispatcher {
  private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);
  private static final int PAYLOAD_PREVIEW_BYTES = 256;

  private final TopicRouter router;
  private final StateSerializer serializer;
  private final TopicPublisher publisher;
  private final MetricsPort metrics;

  /**
   * Creates a dispatcher.
   *
   * @param router resolved topic routes
   * @param serializer payload encoder shared by all topics
   * @param publisher broker publisher
   * @param metrics metrics sink; {@link MetricsPort#NO_OP} when {@code null}
   */
  public EventDispatcher(
      TopicRouter router, StateSerializer serializer, TopicPublisher publisher, MetricsPort metrics) {
    this.router = Objects.requireNonNull(router, "router");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Evaluates the event against every topic and publishes it to the matching ones.
   *
   * @param event state-change event
   * @return per-topic decisions and delivery futures
   * @throws IllegalArgumentException when a matched event cannot be serialized
   */
  public DispatchResult dispatch(StateChangeEvent event) {
    Objects.requireNonNull(event, "event");
    long startNanos = System.nanoTime();
    metrics.increment("bridge.events.received");
    EntityId entityId = event.entityId();

    if (!StateEligibility.isEligible(event)) {
      metrics.increment("bridge.events.ineligible");
      log.trace("Skipping {} without a forwardable state", entityId);
      return DispatchResult.ineligible(entityId);
    }

    List<TopicDecision> decisions = router.decide(entityId);
    Map<String, CompletableFuture<Void>> deliveries = new LinkedHashMap<>();
    byte[] payload = null;
    for (TopicDecision decision : decisions) {
      if (!decision.matched()) {
        continue;
      }
      if (payload == null) {
        payload = serializer.serialize(event.newState());
        metrics.observe("bridge.serialize.bytes", payload.length);
        if (log.isDebugEnabled()) {
          log.debug("Serialized {} ({} bytes): {}", entityId, payload.length,
              Logs.truncate(new String(payload, StandardCharsets.UTF_8), PAYLOAD_PREVIEW_BYTES));
        }
      }
      metrics.increment("bridge.topic.matched");
      deliveries.put(decision.topic(), publish(decision.topic(), entityId, payload));
    }

    if (deliveries.isEmpty()) {
      metrics.increment("bridge.events.unmatched");
      log.trace("No topic accepted {}", entityId);
    }
    metrics.observe("bridge.dispatch.latencyNanos", System.nanoTime() - startNanos);
    return new DispatchResult(entityId, true, decisions, deliveries);
  }

  public TopicRouter router() {
    return router;
  }

  private CompletableFuture<Void> publish(String topic, EntityId entityId, byte[] payload) {
    CompletableFuture<Void> delivery;
    try {
      delivery = publisher.publish(topic, entityId.value(), payload);
      if (delivery == null) {
        delivery = CompletableFuture.completedFuture(null);
      }
    } catch (RuntimeException ex) {
      delivery = CompletableFuture.failedFuture(ex);
    }
    return delivery.whenComplete((ignored, failure) -> {
      if (failure == null) {
        metrics.increment("bridge.publish.ok");
        return;
      }
      metrics.increment("bridge.publish.failed");
      Throwable cause = failure instanceof CompletionException && failure.getCause() != null
          ? failure.getCause()
          : failure;
      log.warn("Failed to publish {} to topic {}: {}", entityId, topic, cause.toString());
      log.debug("Publish failure detail for topic {}", topic, cause);
    });
  }
}
