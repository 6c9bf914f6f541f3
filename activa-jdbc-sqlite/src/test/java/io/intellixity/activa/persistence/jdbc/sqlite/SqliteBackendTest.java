package io.intellixity.activa.persistence.jdbc.sqlite;

import io.intellixity.activa.persistence.capability.CteCapability;
import io.intellixity.activa.persistence.jdbc.JdbcBackends;
import io.intellixity.activa.persistence.mapping.Row;
import io.intellixity.activa.persistence.plan.ColumnValue;
import io.intellixity.activa.persistence.plan.InsertPlan;
import io.intellixity.activa.persistence.plan.QueryPlan;
import io.intellixity.activa.persistence.spi.exec.Backend;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static io.intellixity.activa.persistence.expr.Expressions.col;
import static org.junit.jupiter.api.Assertions.*;

final class SqliteBackendTest {
  @TempDir
  Path dir;

  private Backend open() {
    SQLiteDataSource ds = new SQLiteDataSource();
    ds.setUrl("jdbc:sqlite:" + dir.resolve("backend.db"));
    return JdbcBackends.detect("main", ds);
  }

  @Test
  void detectsDialectAndVersion() {
    Backend backend = open();
    assertEquals(SqliteDialect.ID, backend.dialect().id());
    assertTrue(backend.dialect().capabilities().version().atLeast(3, 35));
    assertTrue(backend.dialect().capabilities().supports(CteCapability.MATERIALIZED_CTE));
  }

  @Test
  void storesBooleansAndInstantsThroughSuggestedAdapters() {
    Backend backend = open();
    backend.executor().update(new SqlStatement("CREATE TABLE events (id INTEGER PRIMARY KEY, done INTEGER, at TEXT)",
        List.of(), SqlStatement.ExecKind.UPDATE));
    Instant at = Instant.parse("2024-05-01T10:15:30Z");
    backend.executor().update(backend.dialect().compileDml(new InsertPlan("events",
        List.of(ColumnValue.of("id", 1), ColumnValue.of("done", true), ColumnValue.of("at", at)), List.of())));

    List<Row> rows = backend.executor().query(backend.dialect().compile(
        QueryPlan.from("events").where(col("done").eq(true)).build()));

    assertEquals(1, rows.size());
    Row row = rows.get(0);
    assertEquals(1, ((Number) row.raw("done")).intValue());
    assertEquals("2024-05-01T10:15:30Z", row.raw("at"));
    assertEquals(Boolean.TRUE, row.get("done", Boolean.class, backend.types()));
    assertEquals(at, row.get("at", Instant.class, backend.types()));
  }
}
