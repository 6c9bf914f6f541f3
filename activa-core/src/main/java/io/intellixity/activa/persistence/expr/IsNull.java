package io.intellixity.activa.persistence.expr;

import java.util.Objects;

public record IsNull(Expression operand, boolean negated) implements Expression {
  public IsNull {
    Objects.requireNonNull(operand, "operand");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitIsNull(this); }
}
