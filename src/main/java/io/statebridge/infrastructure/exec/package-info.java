/**
 * Executor factories for the entity-keyed dispatch lanes.
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Performance:</strong> Bounded queues push back on the event source instead of buffering without limit.</p>
 * <p><strong>Security:</strong> Thread names carry no entity or credential data.</p>
 */
package io.statebridge.infrastructure.exec;
