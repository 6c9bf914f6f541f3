package io.intellixity.activa.persistence.jdbc;

import io.intellixity.activa.persistence.mapping.Row;
import io.intellixity.activa.persistence.spi.exec.AsyncQueryExecutor;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/** Runs the blocking JDBC executor on a dedicated pool; each statement completes its own future. */
public final class AsyncJdbcQueryExecutor implements AsyncQueryExecutor {
  private final JdbcQueryExecutor delegate;
  private final ExecutorService pool;
  private final boolean concurrentStatements;

  /**
   * @param concurrentStatements whether the DataSource hands out independent connections, so that
   *                             several statements may run at once (false for single-connection
   *                             or in-memory databases)
   */
  public AsyncJdbcQueryExecutor(JdbcQueryExecutor delegate, ExecutorService pool, boolean concurrentStatements) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.concurrentStatements = concurrentStatements;
  }

  @Override public String backendId() { return delegate.backendId(); }
  @Override public boolean supportsConcurrentStatements() { return concurrentStatements; }

  @Override
  public CompletableFuture<List<Row>> queryAsync(SqlStatement statement) {
    return CompletableFuture.supplyAsync(() -> delegate.query(statement), pool);
  }

  @Override
  public CompletableFuture<Long> updateAsync(SqlStatement statement) {
    return CompletableFuture.supplyAsync(() -> delegate.update(statement), pool);
  }
}
