package io.intellixity.activa.persistence.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Searched CASE expression. */
public record CaseWhen(List<When> branches, Expression otherwise) implements Expression {
  public CaseWhen {
    branches = branches == null ? List.of() : List.copyOf(branches);
    if (branches.isEmpty()) throw new IllegalArgumentException("CASE requires at least one WHEN branch");
  }

  public record When(Expression condition, Expression result) {
    public When {
      Objects.requireNonNull(condition, "condition");
      Objects.requireNonNull(result, "result");
    }
  }

  public CaseWhen when(Expression condition, Object result) {
    List<When> next = new ArrayList<>(branches);
    next.add(new When(condition, Expressions.wrap(result)));
    return new CaseWhen(next, otherwise);
  }

  public CaseWhen otherwise(Object result) {
    return new CaseWhen(branches, Expressions.wrap(result));
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitCase(this); }
}
