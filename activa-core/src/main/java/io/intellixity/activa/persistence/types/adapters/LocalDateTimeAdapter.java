package io.intellixity.activa.persistence.types.adapters;

import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapter;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Map;

public final class LocalDateTimeAdapter implements TypeAdapter<LocalDateTime> {
  private final boolean isoText;

  public LocalDateTimeAdapter() {
    this(false);
  }

  public LocalDateTimeAdapter(boolean isoText) {
    this.isoText = isoText;
  }

  @Override public Class<LocalDateTime> javaType() { return LocalDateTime.class; }
  @Override public ColumnType columnType() { return isoText ? ColumnType.TEXT : ColumnType.TIMESTAMP; }

  @Override
  public Object toDatabase(LocalDateTime value, Map<String, Object> options) {
    if (value == null) return null;
    return isoText ? value.toString() : Timestamp.valueOf(value);
  }

  @Override
  public LocalDateTime fromDatabase(Object raw, Class<? extends LocalDateTime> target, Map<String, Object> options) {
    if (raw == null) return null;
    if (raw instanceof LocalDateTime ldt) return ldt;
    if (raw instanceof Timestamp ts) return ts.toLocalDateTime();
    return LocalDateTime.parse(String.valueOf(raw).trim().replace(' ', 'T'));
  }
}
