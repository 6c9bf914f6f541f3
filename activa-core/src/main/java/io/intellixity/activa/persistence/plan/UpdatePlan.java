package io.intellixity.activa.persistence.plan;

import io.intellixity.activa.persistence.expr.Expression;

import java.util.List;

public record UpdatePlan(String table, List<ColumnValue> sets, Expression where, List<String> returning)
    implements DmlPlan {
  public UpdatePlan {
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table is required");
    sets = sets == null ? List.of() : List.copyOf(sets);
    returning = returning == null ? List.of() : List.copyOf(returning);
  }
}
