package io.intellixity.activa.persistence.plan;

import io.intellixity.activa.persistence.expr.Expression;
import io.intellixity.activa.persistence.expr.OrderItem;
import io.intellixity.activa.persistence.expr.Star;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable SELECT plan. An empty projection means {@code *}.
 *
 * <p>Plans are usually produced by the query builder; {@link #builder(Source)} is the low-level way
 * to assemble one directly.</p>
 */
public record QueryPlan(
    List<CommonTableExpression> ctes,
    boolean recursive,
    boolean distinct,
    List<Expression> select,
    Source from,
    List<JoinClause> joins,
    Expression where,
    List<Expression> groupBy,
    Expression having,
    List<OrderItem> orderBy,
    OffsetPage page
) implements Queryable {
  public QueryPlan {
    Objects.requireNonNull(from, "from");
    ctes = ctes == null ? List.of() : List.copyOf(ctes);
    select = select == null ? List.of() : List.copyOf(select);
    joins = joins == null ? List.of() : List.copyOf(joins);
    groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
  }

  public static Builder builder(Source from) {
    return new Builder(from);
  }

  public static Builder from(String table) {
    return new Builder(TableSource.of(table));
  }

  public Builder toBuilder() {
    Builder b = new Builder(from);
    b.ctes.addAll(ctes);
    b.recursive = recursive;
    b.distinct = distinct;
    b.select.addAll(select);
    b.joins.addAll(joins);
    b.where = where;
    b.groupBy.addAll(groupBy);
    b.having = having;
    b.orderBy.addAll(orderBy);
    b.page = page;
    return b;
  }

  @Override
  public int arity() {
    if (select.isEmpty()) return UNKNOWN_ARITY;
    for (Expression e : select) {
      if (e instanceof Star) return UNKNOWN_ARITY;
    }
    return select.size();
  }

  public static final class Builder {
    private final List<CommonTableExpression> ctes = new ArrayList<>();
    private boolean recursive;
    private boolean distinct;
    private final List<Expression> select = new ArrayList<>();
    private Source from;
    private final List<JoinClause> joins = new ArrayList<>();
    private Expression where;
    private final List<Expression> groupBy = new ArrayList<>();
    private Expression having;
    private final List<OrderItem> orderBy = new ArrayList<>();
    private OffsetPage page;

    private Builder(Source from) {
      this.from = Objects.requireNonNull(from, "from");
    }

    public Builder with(CommonTableExpression cte) { ctes.add(Objects.requireNonNull(cte, "cte")); return this; }
    public Builder recursive(boolean recursive) { this.recursive = recursive; return this; }
    public Builder distinct(boolean distinct) { this.distinct = distinct; return this; }
    public Builder select(Expression... items) { select.addAll(List.of(items)); return this; }
    public Builder select(List<? extends Expression> items) { select.addAll(items); return this; }
    public Builder clearSelect() { select.clear(); return this; }
    public Builder from(Source from) { this.from = Objects.requireNonNull(from, "from"); return this; }
    public Builder join(JoinClause join) { joins.add(Objects.requireNonNull(join, "join")); return this; }
    public Builder join(JoinKind kind, Source target, Expression on) { return join(new JoinClause(kind, target, on)); }

    /** Replaces the WHERE predicate. */
    public Builder where(Expression where) { this.where = where; return this; }

    /** ANDs {@code predicate} onto the current WHERE. */
    public Builder andWhere(Expression predicate) {
      if (predicate == null) return this;
      this.where = (where == null) ? predicate : where.and(predicate);
      return this;
    }

    public Builder groupBy(Expression... items) { groupBy.addAll(List.of(items)); return this; }
    public Builder having(Expression having) { this.having = having; return this; }
    public Builder orderBy(OrderItem... items) { orderBy.addAll(List.of(items)); return this; }
    public Builder orderBy(List<OrderItem> items) { orderBy.addAll(items); return this; }
    public Builder clearOrderBy() { orderBy.clear(); return this; }
    public Builder page(OffsetPage page) { this.page = page; return this; }

    public Builder limit(long limit) {
      this.page = (page == null) ? OffsetPage.limit(limit) : page.withLimit(limit);
      return this;
    }

    public Builder offset(long offset) {
      this.page = (page == null) ? new OffsetPage(offset, null) : page.withOffset(offset);
      return this;
    }

    public QueryPlan build() {
      return new QueryPlan(ctes, recursive, distinct, select, from, joins, where, groupBy, having, orderBy, page);
    }
  }
}
