package io.intellixity.activa.persistence.spi.exec;

import io.intellixity.activa.persistence.spi.sql.Dialect;
import io.intellixity.activa.persistence.types.TypeAdapterRegistry;

import java.util.Objects;

/**
 * Everything needed to talk to one database: its dialect, the adapters for its binds and reads, and
 * blocking plus (optionally) async executors.
 */
public record Backend(String id, Dialect dialect, TypeAdapterRegistry types,
                      QueryExecutor executor, AsyncQueryExecutor asyncExecutor) {
  public Backend {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(dialect, "dialect");
    Objects.requireNonNull(types, "types");
    Objects.requireNonNull(executor, "executor");
  }

  public AsyncQueryExecutor requireAsync() {
    if (asyncExecutor == null) throw new IllegalStateException("Backend '" + id + "' has no async executor");
    return asyncExecutor;
  }
}
