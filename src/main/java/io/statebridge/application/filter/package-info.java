/**
 * Filter compilation and evaluation.
 * <p><strong>Concurrency:</strong> Compiled filters are immutable and safe to share across dispatch workers.</p>
 * <p><strong>Performance:</strong> Exact patterns resolve through hash lookups; globs compile once to regular
 * expressions.</p>
 */
package io.statebridge.application.filter;
