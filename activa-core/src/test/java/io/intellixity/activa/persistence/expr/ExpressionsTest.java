package io.intellixity.activa.persistence.expr;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.activa.persistence.expr.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class ExpressionsTest {
  @Test
  void eqWithNullBuildsIsNull() {
    Expression e = eq(col("deleted_at"), null);
    assertEquals(new IsNull(col("deleted_at"), false), e);
    assertEquals(new IsNull(col("deleted_at"), true), ne(col("deleted_at"), null));
  }

  @Test
  void orderedComparisonsRejectNull() {
    assertThrows(IllegalArgumentException.class, () -> gt(col("age"), null));
  }

  @Test
  void allEqKeepsInsertionOrderAndNulls() {
    Map<String, Object> filter = new LinkedHashMap<>();
    filter.put("status", "active");
    filter.put("deleted_at", null);
    Expression e = allEq(filter);
    BinaryOp and = assertInstanceOf(BinaryOp.class, e);
    assertEquals(BinaryOperator.AND, and.operator());
    assertEquals(new BinaryOp(BinaryOperator.EQ, col("status"), Literal.of("active")), and.left());
    assertEquals(new IsNull(col("deleted_at"), false), and.right());
  }

  @Test
  void andSkipsNullOperands() {
    assertNull(and());
    assertEquals(col("a").eq(1), and(null, col("a").eq(1), null));
  }

  @Test
  void nodesAreValuesAndShareable() {
    Expression shared = col("x").gt(1);
    Expression a = shared.and(col("y").eq(2));
    Expression b = shared.or(col("z").eq(3));
    assertEquals(col("x").gt(1), shared);
    assertNotEquals(a, b);
  }

  @Test
  void literalCarriesRuntimeType() {
    Literal l = Literal.of(42L);
    assertEquals(Long.class, l.declaredType());
    assertTrue(Literal.of(null).isNullValue());
  }

  @Test
  void inListCopiesValues() {
    InList in = in(col("id"), List.of(1, 2, 3));
    assertEquals(3, in.values().size());
    assertTrue(in(col("id"), List.of()).values().isEmpty());
  }

  @Test
  void functionNamesKeepTheirSpelling() {
    FunctionCall f = Functions.func(" coalesce ", col("a"), 0);
    assertEquals("coalesce", f.name());
    assertEquals("COALESCE", f.canonicalName());
    assertFalse(f.isWindowed());
    assertTrue(Functions.rowNumber().overAll().isWindowed());
  }
}
