package io.statebridge.infrastructure.serialization;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.statebridge.domain.entity.EntityId;
import io.statebridge.domain.entity.EntityState;
import io.statebridge.domain.entity.StateChangeEvent;
import io.statebridge.domain.entity.StateContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes state-bus JSON records into {@link StateChangeEvent}s.
 *
 * <p>Expected shape: {@code {"entity_id": ..., "new_state": {...}|null, "old_state": {...}|null}}.
 * The top-level {@code entity_id} may be omitted when either state carries one; every id present
 * must name the same entity. Timestamps accept ISO-8601 with {@code Z} or a numeric offset.</p>
 *
 * @since 0.1.0
 */
public final class StateEventJsonReader {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Decodes a UTF-8 JSON record.
   *
   * @param payload record bytes
   * @return decoded event
   * @throws IllegalArgumentException when the record is not well-formed
   */
  public StateChangeEvent read(byte[] payload) {
    Objects.requireNonNull(payload, "payload");
    return read(new String(payload, StandardCharsets.UTF_8));
  }

  /**
   * Decodes a JSON record.
   *
   * @param json record text
   * @return decoded event
   * @throws IllegalArgumentException when the record is not well-formed
   */
  public StateChangeEvent read(String json) {
    Objects.requireNonNull(json, "json");
    Map<String, Object> root = asMap(parse(json), "event");
    EntityState newState = readState(root.get("new_state"), "new_state");
    EntityState oldState = readState(root.get("old_state"), "old_state");

    String entityId = optionalString(root.get("entity_id"), "entity_id");
    if (entityId == null && newState != null) {
      entityId = newState.entityId().value();
    }
    if (entityId == null && oldState != null) {
      entityId = oldState.entityId().value();
    }
    if (entityId == null || entityId.isBlank()) {
      throw new IllegalArgumentException("event carries no entity_id");
    }
    requireSameEntity(entityId, newState, "new_state");
    requireSameEntity(entityId, oldState, "old_state");
    return new StateChangeEvent(EntityId.of(entityId), newState, oldState);
  }

  private static void requireSameEntity(String entityId, EntityState state, String context) {
    if (state != null && !state.entityId().value().equals(entityId)) {
      throw new IllegalArgumentException(context + ".entity_id " + state.entityId().value()
          + " does not match event entity_id " + entityId);
    }
  }

  private EntityState readState(Object node, String context) {
    if (node == null) {
      return null;
    }
    Map<String, Object> map = asMap(node, context);
    String entityId = optionalString(map.get("entity_id"), context + ".entity_id");
    if (entityId == null || entityId.isBlank()) {
      throw new IllegalArgumentException(context + ".entity_id is missing");
    }
    Object stateNode = map.get("state");
    String state = stateNode == null ? "" : stateNode.toString();
    Map<String, Object> attributes = map.get("attributes") == null
        ? Map.of()
        : asMap(map.get("attributes"), context + ".attributes");
    Instant lastChanged = readInstant(map.get("last_changed"), context + ".last_changed");
    Instant lastUpdated = readInstant(map.get("last_updated"), context + ".last_updated");
    StateContext stateContext = readContext(map.get("context"), context + ".context");
    return new EntityState(EntityId.of(entityId), state, attributes, lastChanged, lastUpdated, stateContext);
  }

  private StateContext readContext(Object node, String context) {
    if (node == null) {
      return StateContext.empty();
    }
    Map<String, Object> map = asMap(node, context);
    return new StateContext(
        optionalString(map.get("id"), context + ".id"),
        optionalString(map.get("parent_id"), context + ".parent_id"),
        optionalString(map.get("user_id"), context + ".user_id"));
  }

  private Instant readInstant(Object node, String context) {
    if (node == null) {
      return null;
    }
    if (!(node instanceof String text)) {
      throw new IllegalArgumentException(context + " must be an ISO-8601 string");
    }
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(context + " is not an ISO-8601 timestamp: " + text, ex);
    }
  }

  private String optionalString(Object node, String context) {
    if (node == null) {
      return null;
    }
    if (!(node instanceof String text)) {
      throw new IllegalArgumentException(context + " must be a string");
    }
    return text;
  }

  private Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a JSON object");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private Object parse(String json) {
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IllegalArgumentException("empty JSON record");
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null) {
        throw new IllegalArgumentException("JSON record contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON record", ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String name = parser.getCurrentName();
      map.put(name, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }
}
