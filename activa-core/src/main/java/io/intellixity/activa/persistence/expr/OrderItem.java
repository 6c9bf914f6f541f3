package io.intellixity.activa.persistence.expr;

import java.util.Objects;

public record OrderItem(Expression expression, Direction direction) {
  public OrderItem {
    Objects.requireNonNull(expression, "expression");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction { ASC, DESC }

  public static OrderItem asc(Expression e) { return new OrderItem(e, Direction.ASC); }
  public static OrderItem desc(Expression e) { return new OrderItem(e, Direction.DESC); }
}
