package io.intellixity.activa.persistence.expr;

import java.util.Objects;

public record BinaryOp(BinaryOperator operator, Expression left, Expression right) implements Expression {
  public BinaryOp {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitBinary(this); }
}
