package io.intellixity.activa.persistence.jdbc.mysql;

import io.intellixity.activa.persistence.capability.ServerVersion;
import io.intellixity.activa.persistence.spi.sql.Dialect;
import io.intellixity.activa.persistence.spi.sql.DialectProvider;

/** Matches the MariaDB driver ("MariaDB") and MySQL Connector/J talking to MariaDB ("MySQL", "...-MariaDB"). */
public final class MariaDbDialectProvider implements DialectProvider {
  @Override public String dialectId() { return MariaDbDialect.ID; }

  @Override
  public boolean handles(String productName, String productVersion) {
    if (productName == null) return false;
    String p = productName.trim();
    if (p.equalsIgnoreCase("MariaDB")) return true;
    return p.equalsIgnoreCase("MySQL") && isMariaDbVersion(productVersion);
  }

  @Override
  public Dialect create(ServerVersion version) {
    return new MariaDbDialect(version);
  }

  static boolean isMariaDbVersion(String productVersion) {
    return productVersion != null && productVersion.toLowerCase(java.util.Locale.ROOT).contains("mariadb");
  }
}
