/**
 * Input validation helpers for configuration and CLI options.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}s that the CLI
 * maps to configuration or argument exit codes.</p>
 */
package io.statebridge.validation;
