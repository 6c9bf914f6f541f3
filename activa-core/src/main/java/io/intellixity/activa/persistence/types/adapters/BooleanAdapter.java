package io.intellixity.activa.persistence.types.adapters;

import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapter;

import java.util.Locale;
import java.util.Map;

/**
 * Boolean adapter. In numeric mode (backends without a boolean column type) values are written as
 * {@code 1}/{@code 0}. Reading accepts booleans, numbers and the usual textual spellings in both modes.
 */
public final class BooleanAdapter implements TypeAdapter<Boolean> {
  private final boolean numeric;

  public BooleanAdapter() {
    this(false);
  }

  public BooleanAdapter(boolean numeric) {
    this.numeric = numeric;
  }

  @Override public Class<Boolean> javaType() { return Boolean.class; }
  @Override public ColumnType columnType() { return numeric ? ColumnType.INTEGER : ColumnType.BOOLEAN; }

  @Override
  public Object toDatabase(Boolean value, Map<String, Object> options) {
    if (value == null) return null;
    return numeric ? (value ? 1 : 0) : value;
  }

  @Override
  public Boolean fromDatabase(Object raw, Class<? extends Boolean> target, Map<String, Object> options) {
    if (raw == null) return null;
    if (raw instanceof Boolean b) return b;
    if (raw instanceof Number n) return n.intValue() != 0;
    String s = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
    return switch (s) {
      case "1", "t", "true", "y", "yes" -> Boolean.TRUE;
      case "0", "f", "false", "n", "no" -> Boolean.FALSE;
      default -> throw new IllegalArgumentException("Not a boolean value: '" + raw + "'");
    };
  }
}
