package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.types.TypeAdapter;

import java.util.Objects;

/**
 * One persistent field of a model. {@code column} defaults to {@code name}; {@code adapter} is an
 * optional per-field override that wins over the backend's registry.
 */
public record FieldDef(String name, String column, Class<?> javaType, TypeAdapter<?> adapter) {
  public FieldDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(javaType, "javaType");
    if (name.isBlank()) throw new IllegalArgumentException("field name must not be blank");
    column = (column == null || column.isBlank()) ? name : column;
  }

  public static FieldDef of(String name, Class<?> javaType) {
    return new FieldDef(name, null, javaType, null);
  }

  public FieldDef column(String column) { return new FieldDef(name, column, javaType, adapter); }
  public FieldDef adapter(TypeAdapter<?> adapter) { return new FieldDef(name, column, javaType, adapter); }
}
