package io.statebridge.application.port;

import io.statebridge.domain.entity.EntityState;

/**
 * Encodes an entity state into the wire payload sent unmodified to every matching topic.
 *
 * <p>Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface StateSerializer {
  /**
   * Serializes the state.
   *
   * @param state state to encode; never {@code null}
   * @return encoded payload
   * @throws IllegalArgumentException when the state cannot be encoded
   */
  byte[] serialize(EntityState state);
}
