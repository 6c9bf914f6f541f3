package io.intellixity.activa.persistence.expr;

import java.util.Collection;

/**
 * A node of the database-agnostic expression tree.
 *
 * <p>Nodes are immutable. The fluent combinators below always build new nodes, so a fragment can be
 * shared between queries. Nodes carry no dialect knowledge; rendering (including parenthesization by
 * precedence) is done by the dialect compiler.</p>
 */
public interface Expression {
  <R> R accept(ExpressionVisitor<R> visitor);

  default Expression eq(Object other) { return Expressions.eq(this, other); }
  default Expression ne(Object other) { return Expressions.ne(this, other); }
  default Expression gt(Object other) { return Expressions.gt(this, other); }
  default Expression ge(Object other) { return Expressions.ge(this, other); }
  default Expression lt(Object other) { return Expressions.lt(this, other); }
  default Expression le(Object other) { return Expressions.le(this, other); }
  default Expression like(Object pattern) { return Expressions.like(this, pattern); }
  default Expression notLike(Object pattern) { return Expressions.notLike(this, pattern); }

  default Expression in(Collection<?> values) { return Expressions.in(this, values); }
  default Expression notIn(Collection<?> values) { return Expressions.notIn(this, values); }
  default Expression between(Object low, Object high) { return Expressions.between(this, low, high); }
  default Expression notBetween(Object low, Object high) { return Expressions.notBetween(this, low, high); }
  default Expression isNull() { return new IsNull(this, false); }
  default Expression isNotNull() { return new IsNull(this, true); }

  default Expression and(Expression other) { return Expressions.and(this, other); }
  default Expression or(Expression other) { return Expressions.or(this, other); }
  default Expression not() { return Expressions.not(this); }

  default Expression plus(Object other) { return new BinaryOp(BinaryOperator.ADD, this, Expressions.wrap(other)); }
  default Expression minus(Object other) { return new BinaryOp(BinaryOperator.SUBTRACT, this, Expressions.wrap(other)); }
  default Expression times(Object other) { return new BinaryOp(BinaryOperator.MULTIPLY, this, Expressions.wrap(other)); }
  default Expression dividedBy(Object other) { return new BinaryOp(BinaryOperator.DIVIDE, this, Expressions.wrap(other)); }

  default Aliased as(String alias) { return new Aliased(this, alias); }
  default OrderItem asc() { return OrderItem.asc(this); }
  default OrderItem desc() { return OrderItem.desc(this); }
}
