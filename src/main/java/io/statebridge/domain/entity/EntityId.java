package io.statebridge.domain.entity;

import java.util.Objects;
import java.util.Optional;

/**
 * Domain-qualified entity identifier of the form {@code <domain>.<object_id>}.
 *
 * <p>The domain is the substring before the first {@code '.'}. Identifiers without a separator, or
 * with a leading separator, carry no domain; filters treat them as matching no domain rule.</p>
 *
 * @param value raw identifier exactly as published by the state bus; never {@code null}
 * @since 0.1.0
 */
public record EntityId(String value) {
  private static final char SEPARATOR = '.';

  public EntityId {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Wraps the supplied identifier.
   *
   * @param value raw identifier
   * @return entity id
   */
  public static EntityId of(String value) {
    return new EntityId(value);
  }

  /**
   * Returns the domain part, if the identifier has one.
   *
   * @return domain before the first separator; empty when there is no separator or it is leading
   */
  public Optional<String> domain() {
    int idx = value.indexOf(SEPARATOR);
    if (idx <= 0) {
      return Optional.empty();
    }
    return Optional.of(value.substring(0, idx));
  }

  @Override
  public String toString() {
    return value;
  }
}
