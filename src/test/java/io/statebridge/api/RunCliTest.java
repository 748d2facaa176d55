package io.statebridge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.statebridge.config.BrokerSettings;
import io.statebridge.testutil.RecordingTopicPublisher;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RunCliTest {
  private static final String EXPORTER_PROPERTY = "otel.metrics.exporter";

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private String previousExporter;

  @BeforeEach
  void setUp() {
    previousExporter = System.getProperty(EXPORTER_PROPERTY);
    logger = (Logger) LoggerFactory.getLogger(RunCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    CliPrinter.setWriterForTesting(new PrintWriter(new StringWriter(), true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
    if (previousExporter == null) {
      System.clearProperty(EXPORTER_PROPERTY);
    } else {
      System.setProperty(EXPORTER_PROPERTY, previousExporter);
    }
  }

  @Test
  void forwardsJsonLinesInputToMatchingTopics() throws Exception {
    RecordingTopicPublisher publisher = new RecordingTopicPublisher();
    AtomicReference<BrokerSettings> broker = new AtomicReference<>();

    ExitCode code = RunCli.run(new String[] {
        "config=" + CheckCliTest.fixture(),
        "input=" + events(),
        "workers=1",
        "metricsExporter=none"}, settings -> {
          broker.set(settings);
          return publisher;
        });

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("192.168.1.10:9092", broker.get().bootstrapServers());
    assertEquals(4, publisher.sent().size());
    assertEquals(List.of("home.everything", "home.lights"), publisher.topicsFor("light.kitchen"));
    assertEquals(List.of("home.sun"), publisher.topicsFor("sensor.sun_next_dusk"));
    assertEquals(List.of("home.everything"), publisher.topicsFor("light.porch"));
    assertTrue(publisher.sent().get(0).payloadText().startsWith("{\"entity_id\":\"light.kitchen\",\"state\":\"on\""));
    assertTrue(publisher.isClosed());
  }

  @Test
  void missingInputFileIsConfigError() throws Exception {
    RecordingTopicPublisher publisher = new RecordingTopicPublisher();

    ExitCode code = RunCli.run(new String[] {
        "config=" + CheckCliTest.fixture(),
        "input=" + tempDir.resolve("absent.jsonl"),
        "metricsExporter=none"}, settings -> publisher);

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(publisher.sent().isEmpty());
  }

  @Test
  void publisherStartupFailureIsRuntimeFailure() throws Exception {
    ExitCode code = RunCli.run(new String[] {
        "config=" + CheckCliTest.fixture(),
        "input=" + events(),
        "metricsExporter=none"}, settings -> {
          throw new IllegalStateException("broker unreachable");
        });

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
  }

  @Test
  void invalidArgumentsAreRejected() throws Exception {
    assertEquals(ExitCode.INVALID_ARGS, RunCli.run(new String[] {"metricsExporter=none"},
        settings -> new RecordingTopicPublisher()));
    assertEquals(ExitCode.INVALID_ARGS, RunCli.run(new String[] {
        "config=" + CheckCliTest.fixture(), "workers=0", "metricsExporter=none"},
        settings -> new RecordingTopicPublisher()));
    assertEquals(ExitCode.INVALID_ARGS, RunCli.run(new String[] {
        "config=" + CheckCliTest.fixture(), "source=http", "metricsExporter=none"},
        settings -> new RecordingTopicPublisher()));
    assertEquals(ExitCode.INVALID_ARGS, RunCli.run(new String[] {
        "config=" + CheckCliTest.fixture(), "metricsExporter=prometheus"},
        settings -> new RecordingTopicPublisher()));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("metricsExporter")));
  }

  @Test
  void kafkaSourceWithoutTopicIsInvalid() throws Exception {
    ExitCode code = RunCli.run(new String[] {
        "config=" + CheckCliTest.fixture(), "source=KAFKA", "metricsExporter=none"},
        settings -> new RecordingTopicPublisher());

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  private Path events() throws Exception {
    Path copy = tempDir.resolve("events.jsonl");
    Files.copy(Path.of(RunCliTest.class.getResource("/fixtures/events.jsonl").toURI()), copy);
    return copy;
  }
}
