package io.intellixity.activa.persistence.jdbc.sqlite;

import io.intellixity.activa.persistence.capability.ServerVersion;
import io.intellixity.activa.persistence.capability.UnsupportedFeatureException;
import io.intellixity.activa.persistence.plan.*;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.activa.persistence.expr.Expressions.*;
import static io.intellixity.activa.persistence.expr.Functions.*;
import static org.junit.jupiter.api.Assertions.*;

final class SqliteDialectTest {
  private final SqliteDialect current = new SqliteDialect(ServerVersion.parse("3.46.1"));

  @Test
  void offsetOnlyPageNeedsUnboundedLimit() {
    assertEquals("SELECT * FROM t LIMIT -1 OFFSET 5",
        current.compile(QueryPlan.from("t").offset(5).build()).sql());
    assertEquals("SELECT * FROM t LIMIT 2 OFFSET 5",
        current.compile(QueryPlan.from("t").limit(2).offset(5).build()).sql());
  }

  @Test
  void mapsCanonicalFunctionNames() {
    SqlStatement st = current.compile(QueryPlan.from("t")
        .select(nvl(col("a"), 0).as("v"), now().as("ts"), length(col("b")).as("n")).build());
    assertEquals("SELECT IFNULL(a, ?) AS v, CURRENT_TIMESTAMP AS ts, LENGTH(b) AS n FROM t", st.sql());
    assertEquals(List.of(0), st.bindValues());
  }

  @Test
  void materializedHintsFollowLibraryVersion() {
    QueryPlan ids = QueryPlan.from("orders").select(col("id")).build();
    QueryPlan plan = QueryPlan.from("x")
        .with(new CommonTableExpression("x", List.of(), ids, Materialization.MATERIALIZED)).build();

    assertEquals("WITH x AS MATERIALIZED (SELECT id FROM orders) SELECT * FROM x", current.compile(plan).sql());
    SqliteDialect old = new SqliteDialect(ServerVersion.of(3, 34, 1));
    assertThrows(UnsupportedFeatureException.class, () -> old.compile(plan));
  }

  @Test
  void rightJoinNeedsNewerLibrary() {
    QueryPlan plan = QueryPlan.builder(new TableSource("a", "x"))
        .join(JoinKind.RIGHT, new TableSource("b", "y"), col("x", "id").eq(col("y", "id"))).build();
    assertEquals("SELECT * FROM a x RIGHT JOIN b y ON x.id = y.id", current.compile(plan).sql());
    assertThrows(UnsupportedFeatureException.class, () -> new SqliteDialect(ServerVersion.of(3, 38)).compile(plan));
  }

  @Test
  void rejectsIntersectAll() {
    QueryPlan a = QueryPlan.from("a").select(col("id")).build();
    QueryPlan b = QueryPlan.from("b").select(col("id")).build();
    assertThrows(UnsupportedFeatureException.class,
        () -> current.compile(SetOperation.of(SetOperator.INTERSECT, true, a, b)));
    assertEquals("SELECT id FROM a EXCEPT SELECT id FROM b",
        current.compile(SetOperation.of(SetOperator.EXCEPT, false, a, b)).sql());
  }

  @Test
  void explainUsesQueryPlanForm() {
    assertEquals("EXPLAIN QUERY PLAN SELECT * FROM t", current.compileExplain(QueryPlan.from("t").build()).sql());
  }

  @Test
  void jsonPathIsBound() {
    SqlStatement st = current.compile(QueryPlan.from("t").select(jsonExtract(col("doc"), "$.a.b").as("v")).build());
    assertEquals("SELECT JSON_EXTRACT(doc, ?) AS v FROM t", st.sql());
    assertEquals(List.of("$.a.b"), st.bindValues());
  }

  @Test
  void quotesSqliteKeywords() {
    assertEquals("\"limit\"", current.quoteIdentifier("limit"));
    assertEquals("\"pragma\"", current.quoteIdentifier("pragma"));
    assertEquals("Name", current.quoteIdentifier("Name"));
  }

  @Test
  void insertReturning() {
    SqlStatement st = current.compileDml(new InsertPlan("users", List.of(ColumnValue.of("name", "ann")), List.of("id")));
    assertEquals("INSERT INTO users (name) VALUES (?) RETURNING id", st.sql());
  }
}
