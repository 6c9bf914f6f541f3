package io.intellixity.activa.persistence.expr;

import io.intellixity.activa.persistence.plan.Queryable;

import java.util.Objects;

public record InSubquery(Expression operand, Queryable query, boolean negated) implements Expression {
  public InSubquery {
    Objects.requireNonNull(operand, "operand");
    Objects.requireNonNull(query, "query");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitInSubquery(this); }
}
