package io.statebridge.application.dispatch;

import io.statebridge.domain.entity.EntityId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of dispatching one event: per-topic decisions plus the pending deliveries.
 *
 * <p>Delivery futures are the ones returned by the publisher, or already-failed futures when the
 * publish call threw. {@link #settled()} never completes exceptionally.</p>
 *
 * @since 0.1.0
 */
public final class DispatchResult {
  private final EntityId entityId;
  private final boolean eligible;
  private final List<TopicDecision> decisions;
  private final Map<String, CompletableFuture<Void>> deliveries;

  DispatchResult(
      EntityId entityId,
      boolean eligible,
      List<TopicDecision> decisions,
      Map<String, CompletableFuture<Void>> deliveries) {
    this.entityId = Objects.requireNonNull(entityId, "entityId");
    this.eligible = eligible;
    this.decisions = List.copyOf(decisions);
    this.deliveries = Collections.unmodifiableMap(new LinkedHashMap<>(deliveries));
  }

  static DispatchResult ineligible(EntityId entityId) {
    return new DispatchResult(entityId, false, List.of(), Map.of());
  }

  public EntityId entityId() {
    return entityId;
  }

  /**
   * Indicates whether the event carried a forwardable state.
   *
   * @return {@code false} when the event was dropped before filter evaluation
   */
  public boolean eligible() {
    return eligible;
  }

  /**
   * Per-topic decisions in configuration order; empty for ineligible events.
   *
   * @return immutable decisions
   */
  public List<TopicDecision> decisions() {
    return decisions;
  }

  /**
   * Topics the event was handed to, in configuration order.
   *
   * @return matched topic names
   */
  public List<String> matchedTopics() {
    List<String> matched = new ArrayList<>();
    for (TopicDecision decision : decisions) {
      if (decision.matched()) {
        matched.add(decision.topic());
      }
    }
    return matched;
  }

  public Map<String, CompletableFuture<Void>> deliveries() {
    return deliveries;
  }

  /**
   * Returns a future that completes once every delivery has succeeded or failed.
   *
   * @return future that never completes exceptionally
   */
  public CompletableFuture<Void> settled() {
    CompletableFuture<?>[] settled = deliveries.values().stream()
        .map(future -> future.handle((ignored, failure) -> null))
        .toArray(CompletableFuture[]::new);
    return CompletableFuture.allOf(settled);
  }

  /**
   * Lists topics whose delivery has completed exceptionally so far.
   *
   * @return failed topic names in configuration order
   */
  public List<String> failedTopics() {
    List<String> failed = new ArrayList<>();
    for (Map.Entry<String, CompletableFuture<Void>> entry : deliveries.entrySet()) {
      if (entry.getValue().isCompletedExceptionally()) {
        failed.add(entry.getKey());
      }
    }
    return failed;
  }
}
