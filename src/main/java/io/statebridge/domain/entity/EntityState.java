package io.statebridge.domain.entity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one entity's state as carried by a state-change event.
 *
 * <p>Attributes keep their insertion order and may contain {@code null} values, nested maps and
 * lists; they are serialized as-is.</p>
 *
 * @param entityId entity the state belongs to
 * @param state state value, e.g. {@code "on"} or {@code "21.5"}
 * @param attributes immutable attribute map
 * @param lastChanged time the state value last changed; may be {@code null}
 * @param lastUpdated time the state or attributes were last written; may be {@code null}
 * @param context causality context
 * @since 0.1.0
 */
public record EntityState(
    EntityId entityId,
    String state,
    Map<String, Object> attributes,
    Instant lastChanged,
    Instant lastUpdated,
    StateContext context) {

  public EntityState {
    Objects.requireNonNull(entityId, "entityId");
    state = state == null ? "" : state;
    attributes = attributes == null || attributes.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    context = context == null ? StateContext.empty() : context;
  }

  /**
   * Convenience factory for a state with no attributes or context.
   *
   * @param entityId entity id
   * @param state state value
   * @param timestamp value used for both {@code lastChanged} and {@code lastUpdated}
   * @return new state snapshot
   */
  public static EntityState of(String entityId, String state, Instant timestamp) {
    return new EntityState(EntityId.of(entityId), state, Map.of(), timestamp, timestamp, null);
  }
}
