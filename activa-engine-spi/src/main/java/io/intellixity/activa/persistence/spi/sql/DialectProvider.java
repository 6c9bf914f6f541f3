package io.intellixity.activa.persistence.spi.sql;

import io.intellixity.activa.persistence.capability.ServerVersion;

/**
 * Creates a {@link Dialect} for a detected server; discovered via META-INF/activa.factories.
 */
public interface DialectProvider {
  String dialectId();

  /** Whether this provider handles a JDBC {@code DatabaseMetaData.getDatabaseProductName()} value. */
  boolean handles(String productName, String productVersion);

  Dialect create(ServerVersion version);
}
