package io.intellixity.activa.persistence.jdbc.oracle;

import io.intellixity.activa.persistence.capability.ServerVersion;
import io.intellixity.activa.persistence.capability.UnsupportedFeatureException;
import io.intellixity.activa.persistence.plan.*;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.activa.persistence.expr.Expressions.*;
import static io.intellixity.activa.persistence.expr.Functions.*;
import static org.junit.jupiter.api.Assertions.*;

final class OracleDialectTest {
  private final OracleDialect ora19 = new OracleDialect(ServerVersion.of(19, 0));
  private final OracleDialect ora11 = new OracleDialect(
      ServerVersion.parse("Oracle Database 11g Enterprise Edition Release 11.2.0.4.0 - 64bit Production"));

  private static QueryPlan.Builder ordered() {
    return QueryPlan.from("t").orderBy(col("id").asc());
  }

  @Test
  void usesColonNamedPlaceholders() {
    SqlStatement st = ora19.compile(QueryPlan.from("t").where(col("a").eq(1).or(col("b").eq(2))).build());
    assertEquals("SELECT * FROM t WHERE a = :p1 OR b = :p2", st.sql());
  }

  @Test
  void pagesWithOffsetFetchOn12cAndLater() {
    assertEquals("SELECT * FROM t ORDER BY id ASC OFFSET 20 ROWS FETCH NEXT 10 ROWS ONLY",
        ora19.compile(ordered().limit(10).offset(20).build()).sql());
    assertEquals("SELECT * FROM t ORDER BY id ASC OFFSET 0 ROWS FETCH NEXT 10 ROWS ONLY",
        ora19.compile(ordered().limit(10).build()).sql());
  }

  @Test
  void pagesWithRownumOnOlderServers() {
    assertEquals("SELECT * FROM (SELECT * FROM t ORDER BY id ASC) WHERE ROWNUM <= 10",
        ora11.compile(ordered().limit(10).build()).sql());
    assertEquals("SELECT * FROM (SELECT activa_q.*, ROWNUM activa_rn FROM (SELECT * FROM t ORDER BY id ASC) activa_q"
            + " WHERE ROWNUM <= 30) WHERE activa_rn > 20",
        ora11.compile(ordered().limit(10).offset(20).build()).sql());
  }

  @Test
  void spellsExceptAsMinus() {
    QueryPlan a = QueryPlan.from("a").select(col("id")).build();
    QueryPlan b = QueryPlan.from("b").select(col("id")).build();
    assertEquals("SELECT id FROM a MINUS SELECT id FROM b",
        ora19.compile(SetOperation.of(SetOperator.EXCEPT, false, a, b)).sql());
    assertThrows(UnsupportedFeatureException.class,
        () -> ora19.compile(SetOperation.of(SetOperator.EXCEPT, true, a, b)));
    assertEquals("SELECT id FROM a MINUS ALL SELECT id FROM b",
        new OracleDialect(ServerVersion.of(21, 3)).compile(SetOperation.of(SetOperator.EXCEPT, true, a, b)).sql());
  }

  @Test
  void recursiveCteHasNoKeyword() {
    QueryPlan anchor = QueryPlan.from("nodes").select(col("id"), col("parent_id")).where(col("parent_id").isNull()).build();
    QueryPlan member = QueryPlan.builder(new TableSource("nodes", "n"))
        .select(col("n", "id"), col("n", "parent_id"))
        .join(JoinKind.INNER, new TableSource("tree", "r"), col("n", "parent_id").eq(col("r", "id")))
        .build();
    QueryPlan plan = QueryPlan.from("tree")
        .with(new CommonTableExpression("tree", List.of("id", "parent_id"),
            SetOperation.of(SetOperator.UNION, true, anchor, member), Materialization.DEFAULT))
        .recursive(true)
        .build();
    assertEquals("WITH tree (id, parent_id) AS (SELECT id, parent_id FROM nodes WHERE parent_id IS NULL UNION ALL "
        + "SELECT n.id, n.parent_id FROM nodes n INNER JOIN tree r ON n.parent_id = r.id) SELECT * FROM tree",
        ora19.compile(plan).sql());
    assertThrows(UnsupportedFeatureException.class, () -> new OracleDialect(ServerVersion.of(11, 1)).compile(plan));
  }

  @Test
  void jsonValueNeedsConstantPath() {
    SqlStatement st = ora19.compile(QueryPlan.from("t").where(jsonExtract(col("doc"), "$.a").eq("x")).build());
    assertEquals("SELECT * FROM t WHERE JSON_VALUE(doc, '$.a') = :p1", st.sql());
    assertEquals(List.of("x"), st.bindValues());
    assertThrows(InvalidPlanException.class,
        () -> ora19.compile(QueryPlan.from("t").select(jsonExtract(col("doc"), "$.a' OR 1=1").as("v")).build()));
    assertThrows(UnsupportedFeatureException.class,
        () -> ora11.compile(QueryPlan.from("t").select(jsonExtract(col("doc"), "$.a").as("v")).build()));
  }

  @Test
  void mapsFunctionsAndExplain() {
    assertEquals("SELECT NVL(a, :p1) AS v, SYSTIMESTAMP AS ts FROM t",
        ora19.compile(QueryPlan.from("t").select(ifNull(col("a"), 0).as("v"), now().as("ts")).build()).sql());
    assertEquals("EXPLAIN PLAN FOR SELECT * FROM t", ora19.compileExplain(QueryPlan.from("t").build()).sql());
    assertEquals("\"level\"", ora19.quoteIdentifier("level"));
  }

  @Test
  void hasNoReturningResultSets() {
    assertThrows(UnsupportedFeatureException.class, () -> ora19.compileDml(
        new InsertPlan("users", List.of(ColumnValue.of("name", "ann")), List.of("id"))));
  }
}
