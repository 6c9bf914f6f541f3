package io.intellixity.activa.persistence.jdbc.mysql;

import io.intellixity.activa.persistence.capability.ServerVersion;
import io.intellixity.activa.persistence.spi.sql.Dialect;
import io.intellixity.activa.persistence.spi.sql.DialectProvider;

public final class MysqlDialectProvider implements DialectProvider {
  @Override public String dialectId() { return MysqlDialect.ID; }

  @Override
  public boolean handles(String productName, String productVersion) {
    return "MySQL".equalsIgnoreCase(productName == null ? null : productName.trim())
        && !MariaDbDialectProvider.isMariaDbVersion(productVersion);
  }

  @Override
  public Dialect create(ServerVersion version) {
    return new MysqlDialect(version);
  }
}
