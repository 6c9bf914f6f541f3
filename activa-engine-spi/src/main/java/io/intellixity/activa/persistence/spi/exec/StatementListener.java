package io.intellixity.activa.persistence.spi.exec;

import io.intellixity.activa.persistence.spi.sql.SqlStatement;

/** Observes every statement an executor sends. Must be thread-safe. */
public interface StatementListener {
  void onStatement(String backendId, SqlStatement statement);
}
