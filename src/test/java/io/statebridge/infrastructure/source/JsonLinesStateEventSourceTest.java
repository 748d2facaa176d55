package io.statebridge.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.statebridge.domain.entity.StateChangeEvent;
import io.statebridge.testutil.RecordingMetricsPort;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonLinesStateEventSourceTest {
  @TempDir Path tempDir;

  @Test
  void readsEventsAndSkipsMalformedLines() throws Exception {
    Path file = tempDir.resolve("events.jsonl");
    Files.writeString(file, String.join("\n",
        "{\"entity_id\":\"light.kitchen\",\"new_state\":{\"entity_id\":\"light.kitchen\",\"state\":\"on\"}}",
        "",
        "{broken",
        "   ",
        "{\"new_state\":{\"entity_id\":\"switch.fan\",\"state\":\"off\"}}"));
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    JsonLinesStateEventSource source = JsonLinesStateEventSource.forLocation(file.toString(), metrics);
    source.start();

    List<String> ids = new ArrayList<>();
    while (!source.isExhausted()) {
      Optional<StateChangeEvent> event = source.poll();
      event.ifPresent(e -> ids.add(e.entityId().value()));
    }
    source.close();

    assertEquals(List.of("light.kitchen", "switch.fan"), ids);
    assertEquals(1, metrics.count("bridge.source.malformed"));
  }

  @Test
  void exhaustedSourceKeepsReturningEmpty() throws Exception {
    JsonLinesStateEventSource source = JsonLinesStateEventSource.forStream(
        "empty", () -> new ByteArrayInputStream(new byte[0]), null);
    source.start();

    assertFalse(source.isExhausted());
    assertTrue(source.poll().isEmpty());
    assertTrue(source.isExhausted());
    assertTrue(source.poll().isEmpty());
  }

  @Test
  void pollBeforeStartFails() {
    JsonLinesStateEventSource source = JsonLinesStateEventSource.forStream(
        "unused", () -> new ByteArrayInputStream("{}".getBytes(StandardCharsets.UTF_8)), null);

    assertThrows(IllegalStateException.class, source::poll);
  }

  @Test
  void missingFileIsRejectedOnStart() {
    JsonLinesStateEventSource source =
        JsonLinesStateEventSource.forLocation(tempDir.resolve("absent.jsonl").toString(), null);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, source::start);
    assertTrue(ex.getMessage().contains("absent.jsonl"));
  }

  @Test
  void directoryIsNotAnInputFile() {
    JsonLinesStateEventSource source = JsonLinesStateEventSource.forLocation(tempDir.toString(), null);

    assertThrows(IllegalArgumentException.class, source::start);
  }
}
