package io.intellixity.activa.persistence.expr;

import io.intellixity.activa.persistence.types.TypeAdapter;

/**
 * A value that is always sent as a bind parameter (never inlined), except {@code null}.
 *
 * <p>{@code declaredType} defaults to the runtime class of the value. {@code adapter} is an explicit
 * per-value override; when absent the type adapter is resolved when the statement is bound.</p>
 */
public record Literal(Object value, Class<?> declaredType, TypeAdapter<?> adapter) implements Expression {
  public Literal {
    if (declaredType == null && value != null) declaredType = value.getClass();
  }

  public static Literal of(Object value) {
    return new Literal(value, null, null);
  }

  public boolean isNullValue() { return value == null; }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitLiteral(this); }
}
