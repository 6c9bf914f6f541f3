package io.intellixity.activa.persistence.jdbc.oracle;

import io.intellixity.activa.persistence.capability.ServerVersion;
import io.intellixity.activa.persistence.spi.sql.Dialect;
import io.intellixity.activa.persistence.spi.sql.DialectProvider;

public final class OracleDialectProvider implements DialectProvider {
  @Override public String dialectId() { return OracleDialect.ID; }

  @Override
  public boolean handles(String productName, String productVersion) {
    return productName != null && productName.trim().equalsIgnoreCase("Oracle");
  }

  @Override
  public Dialect create(ServerVersion version) {
    return new OracleDialect(version);
  }
}
