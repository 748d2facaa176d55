package io.statebridge.application.port;

import io.statebridge.domain.entity.StateChangeEvent;
import java.util.Optional;

/**
 * <strong>What:</strong> Inbound port delivering state-change events from the state bus.
 * <p><strong>Role:</strong> Implemented by the JSON-lines file reader and the Kafka consumer
 * adapter; polled by {@code StateForwardingUseCase} on a single thread.</p>
 * <p><strong>Thread-safety:</strong> Not required; one poller per source.</p>
 *
 * @since 0.1.0
 */
public interface StateEventSource extends AutoCloseable {
  /**
   * Opens the underlying stream or subscription.
   *
   * @throws Exception when the source cannot be opened
   */
  void start() throws Exception;

  /**
   * Returns the next event if one is available.
   *
   * @return next event, or empty when none arrived within the source's poll interval
   * @throws Exception on unrecoverable read failures
   */
  Optional<StateChangeEvent> poll() throws Exception;

  /**
   * Indicates whether a bounded source has been fully consumed.
   *
   * @return {@code true} once no further events will arrive
   */
  default boolean isExhausted() {
    return false;
  }

  @Override
  void close() throws Exception;
}
