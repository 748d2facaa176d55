package io.statebridge.domain.entity;

import java.util.Objects;

/**
 * State-change record read from the state bus.
 *
 * <p>Either state may be missing: {@code oldState} is absent for newly created entities and
 * {@code newState} is absent when an entity is removed.</p>
 *
 * @param entityId entity that changed
 * @param newState state after the change; may be {@code null}
 * @param oldState state before the change; may be {@code null}
 * @since 0.1.0
 */
public record StateChangeEvent(EntityId entityId, EntityState newState, EntityState oldState) {

  public StateChangeEvent {
    Objects.requireNonNull(entityId, "entityId");
  }

  /**
   * Creates an event for a state that replaced no previous state.
   *
   * @param newState new state; never {@code null}
   * @return event keyed by the state's entity id
   */
  public static StateChangeEvent of(EntityState newState) {
    Objects.requireNonNull(newState, "newState");
    return new StateChangeEvent(newState.entityId(), newState, null);
  }
}
