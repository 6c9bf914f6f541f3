package io.intellixity.activa.persistence.types;

import java.util.Map;

/**
 * Bidirectional conversion between a Java type and its backend column representation.
 *
 * <p>Adapters must be pure: no I/O, no shared mutable state. {@code options} carries per-field
 * settings (for example a JSON view or an enum storage mode) and may be empty, never null.</p>
 */
public interface TypeAdapter<J> {
  Class<J> javaType();

  ColumnType columnType();

  Object toDatabase(J value, Map<String, Object> options);

  J fromDatabase(Object raw, Class<? extends J> target, Map<String, Object> options);
}
