package io.intellixity.activa.persistence.plan;

import io.intellixity.activa.persistence.expr.Expression;

import java.util.List;

public record DeletePlan(String table, Expression where, List<String> returning) implements DmlPlan {
  public DeletePlan {
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table is required");
    returning = returning == null ? List.of() : List.copyOf(returning);
  }
}
