/**
 * Filter rules and topic bindings as declared in configuration.
 * <p>Types here are plain immutable values; evaluation lives in {@code io.statebridge.application.filter}.</p>
 */
package io.statebridge.domain.filter;
