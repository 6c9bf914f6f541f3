package io.intellixity.activa.persistence.jdbc.postgres;

import io.intellixity.activa.persistence.types.TypeAdapter;
import io.intellixity.activa.persistence.types.TypeAdapterProvider;
import io.intellixity.activa.persistence.types.adapters.UuidAdapter;

import java.util.Collection;
import java.util.List;

/** Postgres suggestions (dialectId="postgres"): native {@code uuid}. */
public final class PostgresTypeAdapterProvider implements TypeAdapterProvider {
  @Override
  public String dialectId() {
    return PostgresDialect.ID;
  }

  @Override
  public Collection<TypeAdapter<?>> adapters() {
    return List.of(new UuidAdapter(true));
  }
}
