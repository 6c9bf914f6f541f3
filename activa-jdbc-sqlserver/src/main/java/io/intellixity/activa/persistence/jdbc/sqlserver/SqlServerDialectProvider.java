package io.intellixity.activa.persistence.jdbc.sqlserver;

import io.intellixity.activa.persistence.capability.ServerVersion;
import io.intellixity.activa.persistence.spi.sql.Dialect;
import io.intellixity.activa.persistence.spi.sql.DialectProvider;

public final class SqlServerDialectProvider implements DialectProvider {
  @Override public String dialectId() { return SqlServerDialect.ID; }

  @Override
  public boolean handles(String productName, String productVersion) {
    return productName != null && productName.trim().equalsIgnoreCase("Microsoft SQL Server");
  }

  @Override
  public Dialect create(ServerVersion version) {
    return new SqlServerDialect(version);
  }
}
