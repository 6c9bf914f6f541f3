package io.intellixity.activa.persistence.plan;

import io.intellixity.activa.persistence.expr.Expression;
import io.intellixity.activa.persistence.expr.Expressions;

import java.util.Objects;

public record ColumnValue(String column, Expression value) {
  public ColumnValue {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(value, "value");
  }

  public static ColumnValue of(String column, Object value) {
    return new ColumnValue(column, Expressions.wrap(value));
  }
}
