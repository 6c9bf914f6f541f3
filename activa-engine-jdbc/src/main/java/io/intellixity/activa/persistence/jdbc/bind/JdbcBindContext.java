package io.intellixity.activa.persistence.jdbc.bind;

import io.intellixity.activa.persistence.spi.bind.BindContext;

/** Bind context for one {@code ?} of a prepared statement. */
public interface JdbcBindContext extends BindContext {
  /** JDBC parameter index, starting at 1. */
  int parameterIndex();
}
