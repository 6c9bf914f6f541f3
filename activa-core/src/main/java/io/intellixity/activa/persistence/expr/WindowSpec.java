package io.intellixity.activa.persistence.expr;

import java.util.ArrayList;
import java.util.List;

/** {@code OVER (PARTITION BY ... ORDER BY ... frame)}. */
public record WindowSpec(List<Expression> partitionBy, List<OrderItem> orderBy, WindowFrame frame) {
  public WindowSpec {
    partitionBy = partitionBy == null ? List.of() : List.copyOf(partitionBy);
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
  }

  public static WindowSpec empty() {
    return new WindowSpec(List.of(), List.of(), null);
  }

  public WindowSpec partitionBy(Expression... expressions) {
    List<Expression> next = new ArrayList<>(partitionBy);
    next.addAll(List.of(expressions));
    return new WindowSpec(next, orderBy, frame);
  }

  public WindowSpec orderBy(OrderItem... items) {
    List<OrderItem> next = new ArrayList<>(orderBy);
    next.addAll(List.of(items));
    return new WindowSpec(partitionBy, next, frame);
  }

  public WindowSpec frame(WindowFrame frame) {
    return new WindowSpec(partitionBy, orderBy, frame);
  }
}
