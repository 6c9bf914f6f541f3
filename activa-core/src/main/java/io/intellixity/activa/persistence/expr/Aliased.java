package io.intellixity.activa.persistence.expr;

import java.util.Objects;

/** {@code expression AS alias}; only meaningful in a projection. */
public record Aliased(Expression expression, String alias) implements Expression {
  public Aliased {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(alias, "alias");
    if (alias.isBlank()) throw new IllegalArgumentException("alias must not be blank");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitAliased(this); }
}
