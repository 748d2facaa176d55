/**
 * Long-running pipelines that connect an event source to the dispatcher.
 * <p><strong>Concurrency:</strong> One polling thread feeds single-threaded dispatch lanes keyed by entity id;
 * a full lane blocks the polling thread.</p>
 * <p><strong>Observability:</strong> Sets the {@code pipeline} and {@code entity} MDC keys for log correlation.</p>
 */
package io.statebridge.application.pipeline;
