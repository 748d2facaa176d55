package io.statebridge.application.dispatch;

import io.statebridge.domain.entity.EntityState;
import io.statebridge.domain.entity.StateChangeEvent;
import java.util.Set;

/**
 * Decides whether a state-change event carries a state worth forwarding.
 *
 * <p>Events without a new state (entity removed) and placeholder states ({@code unknown},
 * {@code unavailable}, empty) are not forwarded to any topic.</p>
 */
public final class StateEligibility {
  public static final String STATE_UNKNOWN = "unknown";
  public static final String STATE_UNAVAILABLE = "unavailable";

  private static final Set<String> PLACEHOLDER_STATES = Set.of(STATE_UNKNOWN, STATE_UNAVAILABLE, "");

  private StateEligibility() {}

  public static boolean isEligible(StateChangeEvent event) {
    EntityState state = event.newState();
    return state != null && !PLACEHOLDER_STATES.contains(state.state());
  }
}
