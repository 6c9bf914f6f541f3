package io.intellixity.activa.persistence.jdbc.sqlite;

import io.intellixity.activa.persistence.capability.ServerVersion;
import io.intellixity.activa.persistence.spi.sql.Dialect;
import io.intellixity.activa.persistence.spi.sql.DialectProvider;

public final class SqliteDialectProvider implements DialectProvider {
  @Override public String dialectId() { return SqliteDialect.ID; }

  @Override
  public boolean handles(String productName, String productVersion) {
    return productName != null && productName.trim().equalsIgnoreCase("SQLite");
  }

  @Override
  public Dialect create(ServerVersion version) {
    return new SqliteDialect(version);
  }
}
