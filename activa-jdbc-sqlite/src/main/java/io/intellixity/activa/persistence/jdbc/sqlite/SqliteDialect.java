package io.intellixity.activa.persistence.jdbc.sqlite;

import io.intellixity.activa.persistence.capability.*;
import io.intellixity.activa.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.activa.persistence.jdbc.dialect.ReservedWords;
import io.intellixity.activa.persistence.spi.sql.PlaceholderStyle;

import java.util.Map;
import java.util.Set;

/**
 * SQLite dialect implementation for JDBC.
 *
 * <p>Keeps only SQLite-specific overrides. Generic SQL rendering lives in
 * {@link AbstractJdbcSqlDialect}.</p>
 */
public final class SqliteDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "sqlite";

  private static final Set<String> RESERVED = ReservedWords.with(
      "ABORT", "ACTION", "ADD", "AFTER", "ANALYZE", "ATTACH", "AUTOINCREMENT", "BEFORE", "BEGIN", "CASCADE",
      "COLLATE", "COMMIT", "CONFLICT", "DATABASE", "DEFERRABLE", "DEFERRED", "DETACH", "EACH", "ESCAPE",
      "EXCLUSIVE", "EXPLAIN", "FAIL", "FILTER", "GLOB", "GROUPS", "IF", "IGNORE", "IMMEDIATE", "INDEX",
      "INDEXED", "INITIALLY", "INSTEAD", "ISNULL", "KEY", "LIMIT", "MATCH", "NO", "NOTNULL", "NULLS",
      "OFFSET", "OVER", "PARTITION", "PLAN", "PRAGMA", "QUERY", "RAISE", "RANGE", "RECURSIVE", "REGEXP",
      "REINDEX", "RELEASE", "RENAME", "REPLACE", "RESTRICT", "RETURNING", "ROLLBACK", "ROW", "ROWS",
      "SAVEPOINT", "TEMP", "TEMPORARY", "TRANSACTION", "TRIGGER", "VACUUM", "VIEW", "VIRTUAL", "WINDOW");

  private static final Map<String, String> FUNCTIONS = Map.of(
      "NVL", "IFNULL",
      "ISNULL", "IFNULL",
      "LEN", "LENGTH",
      "SUBSTRING", "SUBSTR",
      "NOW", "CURRENT_TIMESTAMP",
      "GETDATE", "CURRENT_TIMESTAMP",
      "SYSTIMESTAMP", "CURRENT_TIMESTAMP");

  public SqliteDialect(ServerVersion version) {
    super(ID, capabilitiesFor(version));
  }

  /**
   * Feature matrix by library version: CTEs 3.8.3, window functions 3.25, RETURNING and
   * MATERIALIZED hints 3.35, built-in JSON 3.38, RIGHT/FULL joins 3.39.
   */
  public static CapabilityDescriptor capabilitiesFor(ServerVersion v) {
    return CapabilityDescriptor.builder(ID, v)
        .add(SetOperationCapability.UNION, SetOperationCapability.UNION_ALL,
            SetOperationCapability.INTERSECT, SetOperationCapability.EXCEPT)
        .addIf(v.atLeast(3, 8, 3), CteCapability.BASIC_CTE, CteCapability.RECURSIVE_CTE)
        .addIf(v.atLeast(3, 35), CteCapability.MATERIALIZED_CTE)
        .addIf(v.atLeast(3, 25), WindowFunctionCapability.values())
        .add(JoinCapability.INNER_JOIN, JoinCapability.LEFT_JOIN, JoinCapability.CROSS_JOIN)
        .addIf(v.atLeast(3, 39), JoinCapability.RIGHT_JOIN, JoinCapability.FULL_JOIN)
        .addIf(v.atLeast(3, 38), JsonCapability.JSON_EXTRACT)
        .addIf(v.atLeast(3, 35), ReturningCapability.RETURNING_INSERT, ReturningCapability.RETURNING_UPDATE,
            ReturningCapability.RETURNING_DELETE)
        .add(PaginationCapability.LIMIT_OFFSET)
        .add(ExplainCapability.EXPLAIN)
        .build();
  }

  @Override public String productName() { return "SQLite"; }
  @Override public PlaceholderStyle placeholderStyle() { return PlaceholderStyle.QUESTION_MARK; }

  @Override protected String openQuote() { return "\""; }
  @Override protected String closeQuote() { return "\""; }
  @Override protected Set<String> reservedWords() { return RESERVED; }
  @Override protected Map<String, String> functionNames() { return FUNCTIONS; }
  @Override protected String explainPrefix() { return "EXPLAIN QUERY PLAN"; }

  /** SQLite requires a LIMIT before OFFSET; -1 means no limit. */
  @Override protected String unboundedLimit() { return "-1"; }
}
