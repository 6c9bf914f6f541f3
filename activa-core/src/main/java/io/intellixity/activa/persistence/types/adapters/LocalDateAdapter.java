package io.intellixity.activa.persistence.types.adapters;

import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapter;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.Map;

public final class LocalDateAdapter implements TypeAdapter<LocalDate> {
  private final boolean isoText;

  public LocalDateAdapter() {
    this(false);
  }

  public LocalDateAdapter(boolean isoText) {
    this.isoText = isoText;
  }

  @Override public Class<LocalDate> javaType() { return LocalDate.class; }
  @Override public ColumnType columnType() { return isoText ? ColumnType.TEXT : ColumnType.DATE; }

  @Override
  public Object toDatabase(LocalDate value, Map<String, Object> options) {
    if (value == null) return null;
    return isoText ? value.toString() : Date.valueOf(value);
  }

  @Override
  public LocalDate fromDatabase(Object raw, Class<? extends LocalDate> target, Map<String, Object> options) {
    if (raw == null) return null;
    if (raw instanceof LocalDate d) return d;
    if (raw instanceof Date d) return d.toLocalDate();
    if (raw instanceof Timestamp ts) return ts.toLocalDateTime().toLocalDate();
    String s = String.valueOf(raw).trim();
    // tolerate "2024-01-31 00:00:00" coming back from date-as-datetime backends
    int time = s.indexOf(' ') >= 0 ? s.indexOf(' ') : s.indexOf('T');
    return LocalDate.parse(time >= 0 ? s.substring(0, time) : s);
  }
}
