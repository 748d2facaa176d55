/**
 * State-bus value types: entity ids, state snapshots and state-change events.
 */
package io.statebridge.domain.entity;
