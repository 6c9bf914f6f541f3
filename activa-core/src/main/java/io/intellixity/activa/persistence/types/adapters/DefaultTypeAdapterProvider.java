package io.intellixity.activa.persistence.types.adapters;

import io.intellixity.activa.persistence.types.TypeAdapter;
import io.intellixity.activa.persistence.types.TypeAdapterProvider;
import io.intellixity.activa.persistence.types.TypeAdapterRegistry;

import java.util.Collection;
import java.util.List;

/** Global built-in adapters (dialectId="*"). Dialect modules suggest overrides for their backend. */
public final class DefaultTypeAdapterProvider implements TypeAdapterProvider {
  @Override
  public String dialectId() {
    return TypeAdapterRegistry.GLOBAL_DIALECT;
  }

  @Override
  public Collection<TypeAdapter<?>> adapters() {
    return List.of(
        ScalarAdapters.string(),
        ScalarAdapters.integer(),
        ScalarAdapters.longType(),
        ScalarAdapters.shortType(),
        ScalarAdapters.doubleType(),
        ScalarAdapters.floatType(),
        new BooleanAdapter(),
        new DecimalAdapter(),
        new UuidAdapter(),
        new InstantAdapter(),
        new LocalDateTimeAdapter(),
        new LocalDateAdapter(),
        new EnumAdapter(),
        new BytesAdapter(),
        JsonAdapter.forMap(),
        JsonAdapter.forList(),
        JsonAdapter.forNode()
    );
  }
}
