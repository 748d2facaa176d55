/**
 * YAML configuration model and loader for the bridge.
 * <p><strong>Role:</strong> Builds validated {@link io.statebridge.config.BridgeConfig} instances consumed by the
 * CLI before any broker connection is opened.</p>
 * <p><strong>Security:</strong> SASL passwords are redacted from {@code toString()} output.</p>
 */
package io.statebridge.config;
