/**
 * Ports between the dispatch core and its adapters.
 * <p><strong>Role:</strong> {@link io.statebridge.application.port.StateEventSource} is inbound;
 * {@link io.statebridge.application.port.TopicPublisher}, {@link io.statebridge.application.port.StateSerializer} and
 * {@link io.statebridge.application.port.MetricsPort} are outbound.</p>
 */
package io.statebridge.application.port;
