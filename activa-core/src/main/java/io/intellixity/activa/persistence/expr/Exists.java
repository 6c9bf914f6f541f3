package io.intellixity.activa.persistence.expr;

import io.intellixity.activa.persistence.plan.Queryable;

import java.util.Objects;

public record Exists(Queryable query, boolean negated) implements Expression {
  public Exists {
    Objects.requireNonNull(query, "query");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitExists(this); }
}
