package io.intellixity.activa.persistence.plan;

import java.util.List;
import java.util.Objects;

/** {@code name [(columns)] AS [[NOT] MATERIALIZED] (query)}. */
public record CommonTableExpression(String name, List<String> columns, Queryable query,
                                    Materialization materialization) {
  public CommonTableExpression {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("CTE name must not be blank");
    Objects.requireNonNull(query, "query");
    columns = columns == null ? List.of() : List.copyOf(columns);
    materialization = materialization == null ? Materialization.DEFAULT : materialization;
  }

  public static CommonTableExpression of(String name, Queryable query) {
    return new CommonTableExpression(name, List.of(), query, Materialization.DEFAULT);
  }
}
