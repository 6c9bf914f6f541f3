package io.intellixity.activa.persistence.types.adapters;

import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapter;

import java.util.Map;

/**
 * Stores enum constants by name. Reading also accepts an ordinal, for columns written by older
 * ordinal-based mappings. Registered for {@link Enum}, so it covers every enum type.
 */
public final class EnumAdapter implements TypeAdapter<Enum<?>> {
  @SuppressWarnings("unchecked")
  @Override public Class<Enum<?>> javaType() { return (Class<Enum<?>>) (Class<?>) Enum.class; }
  @Override public ColumnType columnType() { return ColumnType.TEXT; }

  @Override
  public Object toDatabase(Enum<?> value, Map<String, Object> options) {
    return value == null ? null : value.name();
  }

  @Override
  public Enum<?> fromDatabase(Object raw, Class<? extends Enum<?>> target, Map<String, Object> options) {
    if (raw == null) return null;
    if (target == null || !target.isEnum()) {
      throw new IllegalArgumentException("Enum decoding requires a concrete enum target type, got " + target);
    }
    if (target.isInstance(raw)) return target.cast(raw);
    Enum<?>[] constants = target.getEnumConstants();
    if (raw instanceof Number n) {
      int ordinal = n.intValue();
      if (ordinal < 0 || ordinal >= constants.length) {
        throw new IllegalArgumentException("Ordinal " + ordinal + " out of range for " + target.getName());
      }
      return constants[ordinal];
    }
    String name = String.valueOf(raw).trim();
    for (Enum<?> c : constants) {
      if (c.name().equals(name)) return c;
    }
    throw new IllegalArgumentException("No constant '" + name + "' in " + target.getName());
  }
}
