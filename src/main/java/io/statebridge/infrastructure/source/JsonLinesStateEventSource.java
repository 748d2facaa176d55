package io.statebridge.infrastructure.source;

import io.statebridge.application.port.MetricsPort;
import io.statebridge.application.port.StateEventSource;
import io.statebridge.domain.entity.StateChangeEvent;
import io.statebridge.infrastructure.serialization.StateEventJsonReader;
import io.statebridge.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link StateEventSource} that replays state-change events from a JSON-lines
 * file or standard input.
 * <p><strong>Why:</strong> Lets operators feed recorded state-bus traffic through the bridge without a
 * live bus.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode one event per non-blank line.</li>
 *   <li>Log, count and skip malformed lines.</li>
 *   <li>Report exhaustion at end of input.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; poll from a single thread.</p>
 *
 * @since 0.1.0
 */
public final class JsonLinesStateEventSource implements StateEventSource {
  private static final Logger log = LoggerFactory.getLogger(JsonLinesStateEventSource.class);
  private static final String STDIN = "-";
  private static final int LINE_PREVIEW_BYTES = 128;

  private final String description;
  private final Supplier<InputStream> input;
  private final Path path;
  private final StateEventJsonReader reader;
  private final MetricsPort metrics;

  private BufferedReader lines;
  private long lineNumber;
  private long delivered;
  private long malformed;
  private volatile boolean exhausted;

  private JsonLinesStateEventSource(
      String description, Path path, Supplier<InputStream> input, StateEventJsonReader reader, MetricsPort metrics) {
    this.description = description;
    this.path = path;
    this.input = input;
    this.reader = Objects.requireNonNull(reader, "reader");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Creates a source for a file path, or standard input when the location is {@code "-"}.
   *
   * @param location file path or {@code "-"}
   * @param metrics metrics sink for malformed-line counts
   * @return unopened source
   */
  public static JsonLinesStateEventSource forLocation(String location, MetricsPort metrics) {
    Objects.requireNonNull(location, "location");
    if (STDIN.equals(location.trim())) {
      return new JsonLinesStateEventSource("<stdin>", null, () -> System.in, new StateEventJsonReader(), metrics);
    }
    Path file = Path.of(location.trim()).toAbsolutePath().normalize();
    return new JsonLinesStateEventSource(file.toString(), file, null, new StateEventJsonReader(), metrics);
  }

  /**
   * Creates a source over an arbitrary stream (primarily for tests).
   *
   * @param description label used in logs
   * @param input stream supplier invoked once by {@link #start()}
   * @param metrics metrics sink
   * @return unopened source
   */
  public static JsonLinesStateEventSource forStream(
      String description, Supplier<InputStream> input, MetricsPort metrics) {
    return new JsonLinesStateEventSource(
        Objects.requireNonNull(description, "description"),
        null,
        Objects.requireNonNull(input, "input"),
        new StateEventJsonReader(),
        metrics);
  }

  @Override
  public void start() throws IOException {
    if (lines != null) {
      return;
    }
    InputStream stream;
    if (path != null) {
      if (!Files.isRegularFile(path)) {
        throw new IllegalArgumentException("input must reference an existing file: " + path);
      }
      if (!Files.isReadable(path)) {
        throw new IOException("input is not readable: " + path);
      }
      stream = Files.newInputStream(path);
    } else {
      stream = Objects.requireNonNull(input.get(), "input supplier returned null");
    }
    lines = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
    lineNumber = 0L;
    delivered = 0L;
    malformed = 0L;
    exhausted = false;
    log.info("Reading state-change events from {}", description);
  }

  @Override
  public Optional<StateChangeEvent> poll() throws IOException {
    if (lines == null) {
      throw new IllegalStateException("source not started");
    }
    if (exhausted) {
      return Optional.empty();
    }
    String line;
    while ((line = lines.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      try {
        StateChangeEvent event = reader.read(line);
        delivered++;
        return Optional.of(event);
      } catch (IllegalArgumentException ex) {
        malformed++;
        metrics.increment("bridge.source.malformed");
        log.warn("Skipping malformed event at {}:{}: {} ({})",
            description, lineNumber, ex.getMessage(), Logs.truncate(line, LINE_PREVIEW_BYTES));
      }
    }
    exhausted = true;
    log.info("Reached end of {} after {} events ({} malformed)", description, delivered, malformed);
    return Optional.empty();
  }

  @Override
  public boolean isExhausted() {
    return exhausted;
  }

  @Override
  public void close() throws IOException {
    BufferedReader current = lines;
    lines = null;
    exhausted = true;
    // stdin stays open for the JVM
    if (current != null && path != null) {
      current.close();
    }
  }
}
