package io.statebridge.domain.entity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EntityIdTest {

  @Test
  void domainIsTextBeforeFirstDot() {
    EntityId id = EntityId.of("sensor.outdoor.temperature");
    assertEquals(Optional.of("sensor"), id.domain());
  }

  @Test
  void idsWithoutDomainReportEmpty() {
    assertTrue(EntityId.of("nodomain").domain().isEmpty());
    assertTrue(EntityId.of(".hidden").domain().isEmpty());
  }

  @Test
  void rejectsNull() {
    assertThrows(NullPointerException.class, () -> EntityId.of(null));
  }

  @Test
  void stateCopiesAttributesAndDefaultsState() {
    Map<String, Object> attributes = new HashMap<>();
    attributes.put("brightness", 200);
    EntityState state = new EntityState(
        EntityId.of("light.kitchen"), null, attributes, Instant.EPOCH, Instant.EPOCH, null);
    attributes.put("color", "red");

    assertEquals("", state.state());
    assertEquals(Map.of("brightness", 200), state.attributes());
    assertEquals(StateContext.empty(), state.context());
    assertThrows(UnsupportedOperationException.class, () -> state.attributes().put("x", 1));
  }

  @Test
  void eventFromStateUsesStateEntityId() {
    StateChangeEvent event = StateChangeEvent.of(EntityState.of("switch.fan", "on", Instant.EPOCH));
    assertEquals(EntityId.of("switch.fan"), event.entityId());
    assertNull(event.oldState());
  }
}
