package io.intellixity.activa.persistence.plan;

import java.util.List;

public record InsertPlan(String table, List<ColumnValue> values, List<String> returning) implements DmlPlan {
  public InsertPlan {
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table is required");
    values = values == null ? List.of() : List.copyOf(values);
    returning = returning == null ? List.of() : List.copyOf(returning);
  }
}
