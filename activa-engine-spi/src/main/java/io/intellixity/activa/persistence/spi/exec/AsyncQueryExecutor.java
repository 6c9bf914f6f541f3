package io.intellixity.activa.persistence.spi.exec;

import io.intellixity.activa.persistence.mapping.Row;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking execution. Compilation and planning are shared with the blocking path; only the
 * fetch differs.
 */
public interface AsyncQueryExecutor {
  String backendId();

  CompletableFuture<List<Row>> queryAsync(SqlStatement statement);

  CompletableFuture<Long> updateAsync(SqlStatement statement);

  /**
   * True when independent statements may be in flight at the same time, each on its own
   * connection. When false, callers issue statements one after another.
   */
  boolean supportsConcurrentStatements();
}
