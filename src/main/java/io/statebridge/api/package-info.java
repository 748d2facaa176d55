/**
 * Command-line entry points: {@code run}, {@code check} and {@code evaluate}.
 * <p><strong>Role:</strong> Outermost adapter; parses {@code key=value} options, loads configuration and wires
 * adapters into the forwarding pipeline.</p>
 * <p><strong>Errors:</strong> Failures map to {@link io.statebridge.api.ExitCode} values; nothing is thrown to the
 * JVM.</p>
 */
package io.statebridge.api;
