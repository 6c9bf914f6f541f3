package io.intellixity.activa.persistence.expr;

import io.intellixity.activa.persistence.plan.Queryable;
import io.intellixity.activa.persistence.types.TypeAdapter;

import java.util.*;

/** Static constructors for expression nodes. Non-expression operands are wrapped as {@link Literal}s. */
public final class Expressions {
  private Expressions() {}

  public static Column col(String name) {
    int dot = name == null ? -1 : name.indexOf('.');
    if (dot > 0 && dot < name.length() - 1) {
      return new Column(name.substring(0, dot), name.substring(dot + 1));
    }
    return new Column(null, name);
  }

  public static Column col(String table, String name) { return new Column(table, name); }

  public static Literal lit(Object value) { return Literal.of(value); }

  /** Literal with an explicit adapter; wins over every registry resolution. */
  public static <J> Literal lit(J value, TypeAdapter<J> adapter) {
    return new Literal(value, adapter.javaType(), adapter);
  }

  public static Star star() { return new Star(null); }
  public static Star star(String table) { return new Star(table); }

  public static RawSql raw(String sql, Object... params) {
    return new RawSql(sql, params == null ? List.of() : Arrays.asList(params));
  }

  public static Expression wrap(Object value) {
    if (value instanceof Expression e) return e;
    if (value instanceof Queryable q) return new Subquery(q);
    return Literal.of(value);
  }

  // ---- comparisons ----

  /** {@code eq(x, null)} builds {@code x IS NULL}. */
  public static Expression eq(Expression left, Object right) {
    if (right == null) return new IsNull(left, false);
    return new BinaryOp(BinaryOperator.EQ, left, wrap(right));
  }

  /** {@code ne(x, null)} builds {@code x IS NOT NULL}. */
  public static Expression ne(Expression left, Object right) {
    if (right == null) return new IsNull(left, true);
    return new BinaryOp(BinaryOperator.NE, left, wrap(right));
  }

  public static Expression gt(Expression left, Object right) { return compare(BinaryOperator.GT, left, right); }
  public static Expression ge(Expression left, Object right) { return compare(BinaryOperator.GE, left, right); }
  public static Expression lt(Expression left, Object right) { return compare(BinaryOperator.LT, left, right); }
  public static Expression le(Expression left, Object right) { return compare(BinaryOperator.LE, left, right); }
  public static Expression like(Expression left, Object pattern) { return compare(BinaryOperator.LIKE, left, pattern); }
  public static Expression notLike(Expression left, Object pattern) { return compare(BinaryOperator.NOT_LIKE, left, pattern); }

  private static Expression compare(BinaryOperator op, Expression left, Object right) {
    if (right == null) throw new IllegalArgumentException(op + " requires a non-null operand");
    return new BinaryOp(op, left, wrap(right));
  }

  public static InList in(Expression operand, Collection<?> values) {
    return new InList(operand, wrapAll(values), false);
  }

  public static InList notIn(Expression operand, Collection<?> values) {
    return new InList(operand, wrapAll(values), true);
  }

  public static InSubquery in(Expression operand, Queryable query) {
    return new InSubquery(operand, query, false);
  }

  public static InSubquery notIn(Expression operand, Queryable query) {
    return new InSubquery(operand, query, true);
  }

  public static Between between(Expression operand, Object low, Object high) {
    return new Between(operand, wrap(low), wrap(high), false);
  }

  public static Between notBetween(Expression operand, Object low, Object high) {
    return new Between(operand, wrap(low), wrap(high), true);
  }

  public static Exists exists(Queryable query) { return new Exists(query, false); }
  public static Exists notExists(Queryable query) { return new Exists(query, true); }
  public static Subquery subquery(Queryable query) { return new Subquery(query); }

  // ---- logical ----

  /** AND of the non-null operands; a single operand is returned as is, none yields {@code null}. */
  public static Expression and(Expression... operands) {
    return fold(BinaryOperator.AND, operands);
  }

  public static Expression or(Expression... operands) {
    return fold(BinaryOperator.OR, operands);
  }

  public static Expression not(Expression operand) {
    return new UnaryOp(UnaryOperator.NOT, Objects.requireNonNull(operand, "operand"));
  }

  public static Expression negate(Expression operand) {
    return new UnaryOp(UnaryOperator.NEGATE, Objects.requireNonNull(operand, "operand"));
  }

  private static Expression fold(BinaryOperator op, Expression[] operands) {
    Expression acc = null;
    if (operands == null) return null;
    for (Expression e : operands) {
      if (e == null) continue;
      acc = (acc == null) ? e : new BinaryOp(op, acc, e);
    }
    return acc;
  }

  /** Equality conjunction from a column/value map; {@code null} values become {@code IS NULL}. */
  public static Expression allEq(Map<String, ?> filter) {
    Expression acc = null;
    for (Map.Entry<String, ?> e : filter.entrySet()) {
      Expression term = eq(col(e.getKey()), e.getValue());
      acc = (acc == null) ? term : new BinaryOp(BinaryOperator.AND, acc, term);
    }
    return acc;
  }

  public static CaseWhen caseWhen(Expression condition, Object result) {
    return new CaseWhen(List.of(new CaseWhen.When(condition, wrap(result))), null);
  }

  private static List<Expression> wrapAll(Collection<?> values) {
    if (values == null) return List.of();
    List<Expression> out = new ArrayList<>(values.size());
    for (Object v : values) out.add(wrap(v));
    return out;
  }
}
