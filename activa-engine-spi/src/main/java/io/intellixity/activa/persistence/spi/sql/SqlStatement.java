package io.intellixity.activa.persistence.spi.sql;

import io.intellixity.activa.persistence.compile.Bind;

import java.util.List;

/**
 * Compiled statement: SQL text in the dialect's placeholder style plus binds in placeholder order.
 */
public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Row-returning statement (SELECT, EXPLAIN, DML with RETURNING). */
    QUERY,
    /** Update count only. */
    UPDATE
  }

  public SqlStatement {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql is required");
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, ExecKind.QUERY);
  }

  /** Bind values in order, for logging in tests and diagnostics. */
  public List<Object> bindValues() {
    return binds.stream().map(Bind::value).toList();
  }
}
