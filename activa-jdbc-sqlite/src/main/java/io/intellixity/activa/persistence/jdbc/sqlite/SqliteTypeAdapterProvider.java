package io.intellixity.activa.persistence.jdbc.sqlite;

import io.intellixity.activa.persistence.types.TypeAdapter;
import io.intellixity.activa.persistence.types.TypeAdapterProvider;
import io.intellixity.activa.persistence.types.adapters.*;

import java.util.Collection;
import java.util.List;

/** SQLite suggestions (dialectId="sqlite"): booleans as 0/1, temporals as ISO-8601 text, decimals as text. */
public final class SqliteTypeAdapterProvider implements TypeAdapterProvider {
  @Override
  public String dialectId() {
    return SqliteDialect.ID;
  }

  @Override
  public Collection<TypeAdapter<?>> adapters() {
    return List.of(
        new BooleanAdapter(true),
        new DecimalAdapter(true),
        new InstantAdapter(true),
        new LocalDateTimeAdapter(true),
        new LocalDateAdapter(true),
        new UuidAdapter(false)
    );
  }
}
