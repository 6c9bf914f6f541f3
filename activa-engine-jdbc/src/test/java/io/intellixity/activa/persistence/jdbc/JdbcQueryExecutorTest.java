package io.intellixity.activa.persistence.jdbc;

import io.intellixity.activa.persistence.jdbc.dialect.StandardDialect;
import io.intellixity.activa.persistence.mapping.Row;
import io.intellixity.activa.persistence.plan.ColumnValue;
import io.intellixity.activa.persistence.plan.InsertPlan;
import io.intellixity.activa.persistence.plan.QueryPlan;
import io.intellixity.activa.persistence.spi.bind.BindOpKind;
import io.intellixity.activa.persistence.spi.exec.Backend;
import io.intellixity.activa.persistence.spi.exec.QueryExecutionException;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.intellixity.activa.persistence.expr.Expressions.col;
import static org.junit.jupiter.api.Assertions.*;

final class JdbcQueryExecutorTest {
  @TempDir
  Path dir;

  private ExecutorService pool;
  private Backend backend;
  private JdbcQueryExecutor executor;

  @BeforeEach
  void setUp() {
    SQLiteDataSource ds = new SQLiteDataSource();
    ds.setUrl("jdbc:sqlite:" + dir.resolve("exec.db"));
    pool = Executors.newFixedThreadPool(2);
    backend = JdbcBackends.create("main", ds, new StandardDialect(), pool, false);
    executor = (JdbcQueryExecutor) backend.executor();
    executor.update(new SqlStatement("CREATE TABLE users (id INTEGER PRIMARY KEY, name TEXT, age INTEGER)",
        List.of(), SqlStatement.ExecKind.UPDATE));
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  private void insert(int id, String name, Integer age) {
    SqlStatement st = backend.dialect().compileDml(new InsertPlan("users", Arrays.asList(
        ColumnValue.of("id", id), ColumnValue.of("name", name), ColumnValue.of("age", age)), List.of()));
    assertEquals(1, executor.update(st));
  }

  @Test
  void bindsAndReadsRowsInOrder() {
    insert(1, "ann", 31);
    insert(2, "bob", null);
    insert(3, "cy", 19);

    SqlStatement st = backend.dialect().compile(QueryPlan.from("users").select(col("id"), col("name"))
        .where(col("age").isNotNull()).orderBy(col("id").desc()).build());
    List<Row> rows = executor.query(st);

    assertEquals(2, rows.size());
    assertEquals(List.of("id", "name"), rows.get(0).labels());
    assertEquals(3L, ((Number) rows.get(0).raw("id")).longValue());
    assertEquals("ann", rows.get(1).raw("NAME"));
  }

  @Test
  void notifiesListenersForEveryStatement() {
    List<String> seen = Collections.synchronizedList(new ArrayList<>());
    executor.addListener((backendId, st) -> seen.add(backendId + ":" + st.sql()));
    insert(1, "ann", 31);
    executor.query(backend.dialect().compile(QueryPlan.from("users").build()));
    backend.requireAsync().queryAsync(backend.dialect().compile(QueryPlan.from("users").limit(1).build())).join();

    assertEquals(List.of(
        "main:INSERT INTO users (id, name, age) VALUES (?, ?, ?)",
        "main:SELECT * FROM users",
        "main:SELECT * FROM users LIMIT 1"), seen);
  }

  @Test
  void asyncExecutorRunsOnThePool() {
    insert(1, "ann", 31);
    List<Row> rows = backend.requireAsync()
        .queryAsync(backend.dialect().compile(QueryPlan.from("users").build())).join();
    assertEquals(1, rows.size());
    assertFalse(backend.requireAsync().supportsConcurrentStatements());
  }

  @Test
  void wrapsDriverFailures() {
    QueryExecutionException e = assertThrows(QueryExecutionException.class,
        () -> executor.query(new SqlStatement("SELECT * FROM missing", List.of())));
    assertEquals("main", e.backendId());
    assertNotNull(e.getCause());
  }

  @Test
  void classifiesStatementsForBinders() {
    assertEquals(BindOpKind.INSERT, JdbcQueryExecutor.opKindOf("  insert into t values (1)"));
    assertEquals(BindOpKind.DELETE, JdbcQueryExecutor.opKindOf("DELETE FROM t"));
    assertEquals(BindOpKind.QUERY, JdbcQueryExecutor.opKindOf("WITH x AS (SELECT 1) SELECT * FROM x"));
  }

  @Test
  void failsWithoutAMatchingDialectProvider() {
    assertThrows(IllegalStateException.class, () -> JdbcBackends.providerFor("Nope", "1.0", List.of()));
  }
}
