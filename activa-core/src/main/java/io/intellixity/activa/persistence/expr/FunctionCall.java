package io.intellixity.activa.persistence.expr;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Function or aggregate call. Dialects look names up by {@link #canonicalName()} to map them to
 * native names; names they do not map are rendered exactly as written.
 */
public record FunctionCall(String name, List<Expression> args, boolean distinct, WindowSpec over) implements Expression {
  public FunctionCall {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("function name must not be blank");
    name = name.trim();
    args = args == null ? List.of() : List.copyOf(args);
  }

  public FunctionCall over(WindowSpec window) {
    return new FunctionCall(name, args, distinct, Objects.requireNonNull(window, "window"));
  }

  /** {@code OVER ()}: the whole result set is one window. */
  public FunctionCall overAll() {
    return over(WindowSpec.empty());
  }

  public String canonicalName() { return name.toUpperCase(Locale.ROOT); }

  public boolean isWindowed() { return over != null; }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitFunction(this); }
}
