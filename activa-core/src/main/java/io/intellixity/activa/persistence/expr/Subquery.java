package io.intellixity.activa.persistence.expr;

import io.intellixity.activa.persistence.plan.Queryable;

import java.util.Objects;

/** Scalar subquery used as an expression. */
public record Subquery(Queryable query) implements Expression {
  public Subquery {
    Objects.requireNonNull(query, "query");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitSubquery(this); }
}
