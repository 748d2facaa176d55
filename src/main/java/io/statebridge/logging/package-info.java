/**
 * Logging utilities: runtime verbosity toggling and payload/credential hygiene.
 * <p><strong>Concurrency:</strong> Stateless helpers; safe from dispatch workers.</p>
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 *
 * @since 0.1.0
 */
package io.statebridge.logging;
