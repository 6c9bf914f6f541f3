package io.intellixity.activa.persistence.jdbc.mysql;

import io.intellixity.activa.persistence.types.TypeAdapter;
import io.intellixity.activa.persistence.types.TypeAdapterProvider;
import io.intellixity.activa.persistence.types.adapters.BooleanAdapter;
import io.intellixity.activa.persistence.types.adapters.UuidAdapter;

import java.util.Collection;
import java.util.List;

/** MySQL suggestions (dialectId="mysql"): BOOLEAN is TINYINT(1), UUIDs are CHAR(36). */
public class MysqlTypeAdapterProvider implements TypeAdapterProvider {
  @Override
  public String dialectId() {
    return MysqlDialect.ID;
  }

  @Override
  public Collection<TypeAdapter<?>> adapters() {
    return List.of(new BooleanAdapter(true), new UuidAdapter(false));
  }

  /** Same suggestions for MariaDB. */
  public static final class MariaDb extends MysqlTypeAdapterProvider {
    @Override
    public String dialectId() {
      return MariaDbDialect.ID;
    }
  }
}
