package io.intellixity.activa.persistence.jdbc.dialect;

import io.intellixity.activa.persistence.spi.sql.Dialect;

/** Dialect for JDBC engines (statement rendering only). */
public interface JdbcDialect extends Dialect {
  /** Product name as reported by {@code DatabaseMetaData}, for diagnostics. */
  String productName();
}
