package io.intellixity.activa.persistence.expr;

import java.util.Objects;

public record UnaryOp(UnaryOperator operator, Expression operand) implements Expression {
  public UnaryOp {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(operand, "operand");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitUnary(this); }
}
