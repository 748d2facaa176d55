package io.statebridge.domain.entity;

/**
 * Causality context attached to a state by the state bus.
 *
 * @param id context id; may be {@code null}
 * @param parentId parent context id; may be {@code null}
 * @param userId id of the user who triggered the change; may be {@code null}
 */
public record StateContext(String id, String parentId, String userId) {
  private static final StateContext EMPTY = new StateContext(null, null, null);

  public static StateContext empty() {
    return EMPTY;
  }
}
