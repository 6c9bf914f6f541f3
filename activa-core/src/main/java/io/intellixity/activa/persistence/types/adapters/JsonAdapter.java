package io.intellixity.activa.persistence.types.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapter;

import java.util.List;
import java.util.Map;

/**
 * JSON documents stored as text (or a native JSON column, which binders handle per dialect).
 * Encoding and decoding go through one shared Jackson {@link ObjectMapper}.
 */
public final class JsonAdapter<J> implements TypeAdapter<J> {
  static final ObjectMapper JSON = new ObjectMapper();

  private final Class<J> javaType;

  private JsonAdapter(Class<J> javaType) {
    this.javaType = javaType;
  }

  @SuppressWarnings("unchecked")
  public static JsonAdapter<Map<String, Object>> forMap() {
    return new JsonAdapter<>((Class<Map<String, Object>>) (Class<?>) Map.class);
  }

  @SuppressWarnings("unchecked")
  public static JsonAdapter<List<Object>> forList() {
    return new JsonAdapter<>((Class<List<Object>>) (Class<?>) List.class);
  }

  public static JsonAdapter<JsonNode> forNode() {
    return new JsonAdapter<>(JsonNode.class);
  }

  @Override public Class<J> javaType() { return javaType; }
  @Override public ColumnType columnType() { return ColumnType.JSON; }

  @Override
  public Object toDatabase(J value, Map<String, Object> options) {
    if (value == null) return null;
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to JSON-encode " + value.getClass().getName(), e);
    }
  }

  @Override
  public J fromDatabase(Object raw, Class<? extends J> target, Map<String, Object> options) {
    if (raw == null) return null;
    Class<? extends J> type = (target == null) ? javaType : target;
    if (type.isInstance(raw)) return type.cast(raw);
    // PGobject and friends expose the document through toString()
    String text = (raw instanceof byte[] b) ? new String(b, java.nio.charset.StandardCharsets.UTF_8) : raw.toString();
    try {
      return JSON.readValue(text, type);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to JSON-decode column value into " + type.getName(), e);
    }
  }
}
