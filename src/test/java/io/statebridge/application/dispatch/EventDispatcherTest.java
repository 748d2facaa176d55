package io.statebridge.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.statebridge.application.port.StateSerializer;
import io.statebridge.domain.entity.EntityId;
import io.statebridge.domain.entity.EntityState;
import io.statebridge.domain.entity.StateChangeEvent;
import io.statebridge.domain.filter.FilterSpecification;
import io.statebridge.domain.filter.TopicConfiguration;
import io.statebridge.testutil.RecordingMetricsPort;
import io.statebridge.testutil.RecordingTopicPublisher;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class EventDispatcherTest {
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private final AtomicInteger serializations = new AtomicInteger();
  private final StateSerializer countingSerializer = state -> {
    serializations.incrementAndGet();
    return (state.entityId() + "=" + state.state()).getBytes(StandardCharsets.UTF_8);
  };

  private RecordingMetricsPort metrics;
  private RecordingTopicPublisher publisher;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    publisher = new RecordingTopicPublisher();
    logger = (Logger) LoggerFactory.getLogger(EventDispatcher.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
  }

  @Test
  void serializesOnceForManyTopics() {
    EventDispatcher dispatcher = dispatcher(List.of(
        TopicConfiguration.inheriting("home.a"),
        TopicConfiguration.inheriting("home.b"),
        TopicConfiguration.inheriting("home.c")), Optional.empty());

    DispatchResult result = dispatcher.dispatch(event("sensor.sun_next_dusk", "2024-06-01T20:00:00+00:00"));

    assertEquals(1, serializations.get());
    assertEquals(List.of("home.a", "home.b", "home.c"), result.matchedTopics());
    List<RecordingTopicPublisher.Sent> sent = publisher.sent();
    assertEquals(3, sent.size());
    for (RecordingTopicPublisher.Sent record : sent) {
      assertEquals("sensor.sun_next_dusk", record.key());
      assertArrayEquals(sent.get(0).payload(), record.payload());
    }
    assertEquals(3, metrics.count("bridge.publish.ok"));
    assertEquals(3, metrics.count("bridge.topic.matched"));
    assertEquals(1, metrics.observed("bridge.serialize.bytes").size());
    assertEquals(1, metrics.observed("bridge.dispatch.latencyNanos").size());
  }

  @Test
  void skipsSerializationWhenNothingMatches() {
    EventDispatcher dispatcher = dispatcher(List.of(
        TopicConfiguration.filtered("home.lights", FilterSpecification.builder().includeDomains("light").build())),
        Optional.empty());

    DispatchResult result = dispatcher.dispatch(event("switch.fan", "on"));

    assertTrue(result.eligible());
    assertTrue(result.matchedTopics().isEmpty());
    assertEquals(List.of(new TopicDecision("home.lights", false)), result.decisions());
    assertEquals(0, serializations.get());
    assertTrue(publisher.sent().isEmpty());
    assertEquals(1, metrics.count("bridge.events.unmatched"));
  }

  @Test
  void fanOutFollowsEffectiveFilters() {
    EventDispatcher dispatcher = dispatcher(List.of(
        TopicConfiguration.inheriting("A"),
        TopicConfiguration.filtered("B",
            FilterSpecification.builder().includeEntities("sensor.sun_next_dusk").build())),
        Optional.empty());

    dispatcher.dispatch(event("sensor.sun_next_dusk", "x"));
    dispatcher.dispatch(event("sensor.sun_next_dawn", "y"));

    assertEquals(List.of("A", "B"), publisher.topicsFor("sensor.sun_next_dusk"));
    assertEquals(List.of("A"), publisher.topicsFor("sensor.sun_next_dawn"));
  }

  @Test
  void synchronousPublishFailureDoesNotStopOtherTopics() {
    publisher.throwOn("home.a");
    EventDispatcher dispatcher = dispatcher(List.of(
        TopicConfiguration.inheriting("home.a"),
        TopicConfiguration.inheriting("home.b")), Optional.empty());

    DispatchResult result = dispatcher.dispatch(event("light.kitchen", "on"));
    result.settled().join();

    assertEquals(List.of("home.b"), publisher.topicsFor("light.kitchen"));
    assertEquals(List.of("home.a"), result.failedTopics());
    assertEquals(1, metrics.count("bridge.publish.failed"));
    assertEquals(1, metrics.count("bridge.publish.ok"));
    assertTrue(appender.list.stream()
        .anyMatch(logEvent -> logEvent.getLevel() == Level.WARN
            && logEvent.getFormattedMessage().contains("home.a")
            && logEvent.getFormattedMessage().contains("light.kitchen")));
  }

  @Test
  void asynchronousPublishFailureIsIsolated() {
    publisher.failAsync("home.b");
    EventDispatcher dispatcher = dispatcher(List.of(
        TopicConfiguration.inheriting("home.a"),
        TopicConfiguration.inheriting("home.b"),
        TopicConfiguration.inheriting("home.c")), Optional.empty());

    DispatchResult result = dispatcher.dispatch(event("light.kitchen", "on"));
    result.settled().join();

    assertEquals(List.of("home.a", "home.b", "home.c"), publisher.topicsFor("light.kitchen"));
    assertEquals(List.of("home.b"), result.failedTopics());
    assertEquals(2, metrics.count("bridge.publish.ok"));
    assertEquals(1, metrics.count("bridge.publish.failed"));
  }

  @Test
  void ineligibleStatesAreNotForwarded() {
    EventDispatcher dispatcher = dispatcher(List.of(TopicConfiguration.inheriting("home.all")), Optional.empty());

    DispatchResult unavailable = dispatcher.dispatch(event("light.porch", StateEligibility.STATE_UNAVAILABLE));
    DispatchResult removed = dispatcher.dispatch(new StateChangeEvent(EntityId.of("switch.fan"), null,
        EntityState.of("switch.fan", "on", NOW)));

    assertFalse(unavailable.eligible());
    assertFalse(removed.eligible());
    assertTrue(removed.decisions().isEmpty());
    assertEquals(0, serializations.get());
    assertEquals(2, metrics.count("bridge.events.ineligible"));
    assertEquals(2, metrics.count("bridge.events.received"));
  }

  @Test
  void globalExclusionAppliesOnlyToInheritingTopics() {
    FilterSpecification global = FilterSpecification.builder().excludeEntities("sensor.sun_next_dusk").build();
    EventDispatcher dispatcher = dispatcher(List.of(
        TopicConfiguration.inheriting("X"),
        TopicConfiguration.filtered("Y", FilterSpecification.builder().includeEntities("sensor.sun_*").build())),
        Optional.of(global));

    DispatchResult result = dispatcher.dispatch(event("sensor.sun_next_dusk", "dusk"));

    assertEquals(List.of("Y"), result.matchedTopics());
    assertEquals(List.of("Y"), publisher.topicsFor("sensor.sun_next_dusk"));
  }

  private EventDispatcher dispatcher(List<TopicConfiguration> topics, Optional<FilterSpecification> global) {
    return new EventDispatcher(TopicRouter.resolve(topics, global), countingSerializer, publisher, metrics);
  }

  private static StateChangeEvent event(String entityId, String state) {
    return StateChangeEvent.of(EntityState.of(entityId, state, NOW));
  }
}
