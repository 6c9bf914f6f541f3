package io.intellixity.activa.persistence.expr;

import java.util.Objects;

public record Between(Expression operand, Expression low, Expression high, boolean negated) implements Expression {
  public Between {
    Objects.requireNonNull(operand, "operand");
    Objects.requireNonNull(low, "low");
    Objects.requireNonNull(high, "high");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitBetween(this); }
}
