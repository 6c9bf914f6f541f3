package io.intellixity.activa.persistence.spi.bind;

import io.intellixity.activa.persistence.compile.Bind;
import io.intellixity.activa.persistence.types.AdapterDirection;
import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapter;
import io.intellixity.activa.persistence.types.TypeAdapterRegistry;

import java.util.Map;
import java.util.Objects;

/**
 * Resolves each bind's type adapter at bind time and encodes the value for the driver.
 *
 * <p>Precedence is the bind's explicit adapter, then the registry (runtime registrations, dialect
 * suggestions, globals). A non-null value with no adapter fails with
 * {@link io.intellixity.activa.persistence.types.UnregisteredTypeException}.</p>
 */
public final class BindEncoder {
  private final TypeAdapterRegistry types;

  public BindEncoder(TypeAdapterRegistry types) {
    this.types = Objects.requireNonNull(types, "types");
  }

  public Encoded encode(Bind bind) {
    if (bind.value() == null) {
      TypeAdapter<?> a = bind.adapter() != null ? bind.adapter() : types.find(bind.javaType()).orElse(null);
      return new Encoded(null, a == null ? null : a.columnType());
    }
    Class<?> type = bind.adapter() != null ? bind.adapter().javaType() : bind.javaType();
    @SuppressWarnings("unchecked")
    TypeAdapter<Object> a = (TypeAdapter<Object>) types.resolve(type, AdapterDirection.TO_DATABASE, bind.adapter());
    return new Encoded(a.toDatabase(bind.value(), Map.of()), a.columnType());
  }

  public record Encoded(Object value, ColumnType columnType) {}
}
