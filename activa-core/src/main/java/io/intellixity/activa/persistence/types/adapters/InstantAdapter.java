package io.intellixity.activa.persistence.types.adapters;

import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapter;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Instant adapter. Writes {@link Timestamp} by default, or ISO-8601 text for backends without a
 * timestamp type. Reads timestamps, offset date-times, epoch millis and ISO text (with or without
 * offset; no offset means UTC).
 */
public final class InstantAdapter implements TypeAdapter<Instant> {
  private final boolean isoText;

  public InstantAdapter() {
    this(false);
  }

  public InstantAdapter(boolean isoText) {
    this.isoText = isoText;
  }

  @Override public Class<Instant> javaType() { return Instant.class; }
  @Override public ColumnType columnType() { return isoText ? ColumnType.TEXT : ColumnType.TIMESTAMP; }

  @Override
  public Object toDatabase(Instant value, Map<String, Object> options) {
    if (value == null) return null;
    return isoText ? value.toString() : Timestamp.from(value);
  }

  @Override
  public Instant fromDatabase(Object raw, Class<? extends Instant> target, Map<String, Object> options) {
    if (raw == null) return null;
    if (raw instanceof Instant i) return i;
    if (raw instanceof Timestamp ts) return ts.toInstant();
    if (raw instanceof OffsetDateTime odt) return odt.toInstant();
    if (raw instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
    if (raw instanceof java.util.Date d) return d.toInstant();
    if (raw instanceof Number n) return Instant.ofEpochMilli(n.longValue());
    String s = String.valueOf(raw).trim();
    try {
      return Instant.parse(s);
    } catch (DateTimeParseException e) {
      return LocalDateTime.parse(s.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
    }
  }
}
