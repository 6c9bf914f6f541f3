package io.intellixity.activa.persistence.expr;

import java.util.List;
import java.util.Objects;

/**
 * {@code operand [NOT] IN (values)}. An empty value list is legal: it compiles to a constant
 * false predicate ({@code 1 = 0}), or constant true when negated.
 */
public record InList(Expression operand, List<Expression> values, boolean negated) implements Expression {
  public InList {
    Objects.requireNonNull(operand, "operand");
    values = values == null ? List.of() : List.copyOf(values);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitInList(this); }
}
