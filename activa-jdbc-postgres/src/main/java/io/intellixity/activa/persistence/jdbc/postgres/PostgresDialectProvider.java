package io.intellixity.activa.persistence.jdbc.postgres;

import io.intellixity.activa.persistence.capability.ServerVersion;
import io.intellixity.activa.persistence.spi.sql.Dialect;
import io.intellixity.activa.persistence.spi.sql.DialectProvider;

public final class PostgresDialectProvider implements DialectProvider {
  @Override public String dialectId() { return PostgresDialect.ID; }

  @Override
  public boolean handles(String productName, String productVersion) {
    return productName != null && productName.trim().equalsIgnoreCase("PostgreSQL");
  }

  @Override
  public Dialect create(ServerVersion version) {
    return new PostgresDialect(version);
  }
}
