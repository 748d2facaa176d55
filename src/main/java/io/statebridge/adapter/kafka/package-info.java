/**
 * Kafka adapters: the per-topic publisher and the state-bus consumer.
 * <p><strong>Role:</strong> Adapter layer; implements {@link io.statebridge.application.port.TopicPublisher} and
 * {@link io.statebridge.application.port.StateEventSource} with Kafka clients.</p>
 * <p><strong>Concurrency:</strong> One producer is shared by all dispatch workers; the consumer is polled from
 * a single thread.</p>
 * <p><strong>Security:</strong> SASL credentials come from configuration and are never logged.</p>
 */
package io.statebridge.adapter.kafka;
