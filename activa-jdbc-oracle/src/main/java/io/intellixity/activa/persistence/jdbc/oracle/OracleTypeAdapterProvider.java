package io.intellixity.activa.persistence.jdbc.oracle;

import io.intellixity.activa.persistence.types.TypeAdapter;
import io.intellixity.activa.persistence.types.TypeAdapterProvider;
import io.intellixity.activa.persistence.types.adapters.BooleanAdapter;
import io.intellixity.activa.persistence.types.adapters.UuidAdapter;

import java.util.Collection;
import java.util.List;

/** Oracle suggestions (dialectId="oracle"): NUMBER(1) booleans, UUIDs as VARCHAR2(36). */
public final class OracleTypeAdapterProvider implements TypeAdapterProvider {
  @Override
  public String dialectId() {
    return OracleDialect.ID;
  }

  @Override
  public Collection<TypeAdapter<?>> adapters() {
    return List.of(new BooleanAdapter(true), new UuidAdapter(false));
  }
}
