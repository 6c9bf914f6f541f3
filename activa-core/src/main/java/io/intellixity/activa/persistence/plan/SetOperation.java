package io.intellixity.activa.persistence.plan;

import io.intellixity.activa.persistence.expr.OrderItem;

import java.util.List;
import java.util.Objects;

/**
 * {@code left UNION|INTERSECT|EXCEPT [ALL] right}, with ordering and paging only on the outer result.
 * Operands are any {@link Queryable}, so set operations nest.
 */
public record SetOperation(SetOperator operator, boolean all, Queryable left, Queryable right,
                           List<OrderItem> orderBy, OffsetPage page) implements Queryable {
  public SetOperation {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
  }

  public static SetOperation of(SetOperator operator, boolean all, Queryable left, Queryable right) {
    return new SetOperation(operator, all, left, right, List.of(), null);
  }

  public SetOperation orderBy(List<OrderItem> orderBy) {
    return new SetOperation(operator, all, left, right, orderBy, page);
  }

  public SetOperation page(OffsetPage page) {
    return new SetOperation(operator, all, left, right, orderBy, page);
  }

  @Override
  public int arity() {
    int l = left.arity();
    return l != UNKNOWN_ARITY ? l : right.arity();
  }
}
