package io.statebridge.infrastructure.serialization;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import io.statebridge.application.port.StateSerializer;
import io.statebridge.domain.entity.EntityState;
import io.statebridge.domain.entity.StateContext;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes entity states as UTF-8 JSON objects.
 *
 * <p>Key order: {@code entity_id}, {@code state}, {@code attributes}, {@code last_changed},
 * {@code last_updated}, {@code context}. Timestamps are written as
 * ISO-8601 strings; temporal attribute values and values of any other type are written via
 * {@link Object#toString()}, which yields ISO-8601 text for {@code java.time} types.</p>
 * <p>Thread-safe; {@link JsonFactory} is shared and generators are per call.</p>
 *
 * @since 0.1.0
 */
public final class JsonStateSerializer implements StateSerializer {
  private static final int INITIAL_BUFFER = 256;

  private final JsonFactory factory = new JsonFactory();

  @Override
  public byte[] serialize(EntityState state) {
    Objects.requireNonNull(state, "state");
    ByteArrayOutputStream out = new ByteArrayOutputStream(INITIAL_BUFFER);
    try (JsonGenerator generator = factory.createGenerator(out, JsonEncoding.UTF8)) {
      generator.writeStartObject();
      generator.writeStringField("entity_id", state.entityId().value());
      generator.writeStringField("state", state.state());
      generator.writeFieldName("attributes");
      writeMap(generator, state.attributes());
      writeInstant(generator, "last_changed", state.lastChanged());
      writeInstant(generator, "last_updated", state.lastUpdated());
      writeContext(generator, state.context());
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unable to serialize state of " + state.entityId(), ex);
    }
    return out.toByteArray();
  }

  private void writeInstant(JsonGenerator generator, String field, Instant value) throws IOException {
    if (value == null) {
      generator.writeNullField(field);
    } else {
      generator.writeStringField(field, value.toString());
    }
  }

  private void writeContext(JsonGenerator generator, StateContext context) throws IOException {
    generator.writeObjectFieldStart("context");
    writeNullableString(generator, "id", context.id());
    writeNullableString(generator, "parent_id", context.parentId());
    writeNullableString(generator, "user_id", context.userId());
    generator.writeEndObject();
  }

  private void writeNullableString(JsonGenerator generator, String field, String value) throws IOException {
    if (value == null) {
      generator.writeNullField(field);
    } else {
      generator.writeStringField(field, value);
    }
  }

  private void writeMap(JsonGenerator generator, Map<?, ?> map) throws IOException {
    generator.writeStartObject();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      generator.writeFieldName(String.valueOf(entry.getKey()));
      writeValue(generator, entry.getValue());
    }
    generator.writeEndObject();
  }

  private void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof String str) {
      generator.writeString(str);
    } else if (value instanceof Boolean bool) {
      generator.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      writeFloating(generator, ((Number) value).doubleValue());
    } else if (value instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      generator.writeNumber(integer);
    } else if (value instanceof Map<?, ?> nested) {
      writeMap(generator, nested);
    } else if (value instanceof Iterable<?> iterable) {
      generator.writeStartArray();
      for (Object element : iterable) {
        writeValue(generator, element);
      }
      generator.writeEndArray();
    } else if (value instanceof Object[] array) {
      generator.writeStartArray();
      for (Object element : array) {
        writeValue(generator, element);
      }
      generator.writeEndArray();
    } else {
      generator.writeString(value.toString());
    }
  }

  private void writeFloating(JsonGenerator generator, double value) throws IOException {
    // JSON has no NaN or Infinity
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      generator.writeNull();
    } else {
      generator.writeNumber(value);
    }
  }
}
