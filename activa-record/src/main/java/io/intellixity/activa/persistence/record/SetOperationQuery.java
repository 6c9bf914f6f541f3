package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.expr.OrderItem;
import io.intellixity.activa.persistence.plan.OffsetPage;
import io.intellixity.activa.persistence.plan.SetOperation;
import io.intellixity.activa.persistence.plan.SetOperator;
import io.intellixity.activa.persistence.spi.exec.Backend;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static io.intellixity.activa.persistence.expr.Expressions.col;

/**
 * Result of combining queries with UNION, INTERSECT or EXCEPT. Rows hydrate as the left operand's
 * model; ordering and paging apply to the combined result.
 */
public final class SetOperationQuery {
  private final ActivaContext ctx;
  private final ModelDescriptor model;
  private final SetOperation operation;
  private final List<EagerLoad> eagerLoads;

  SetOperationQuery(ActivaContext ctx, ModelDescriptor model, SetOperation operation, List<EagerLoad> eagerLoads) {
    this.ctx = ctx;
    this.model = model;
    this.operation = operation;
    this.eagerLoads = List.copyOf(eagerLoads);
  }

  static void requireSameBackend(Backend left, Backend right) {
    if (!left.id().equals(right.id())) {
      throw new IllegalArgumentException("Set operation operands live on different backends: "
          + left.id() + " and " + right.id());
    }
  }

  public SetOperationQuery union(ActiveQuery other) { return combine(SetOperator.UNION, false, other); }
  public SetOperationQuery unionAll(ActiveQuery other) { return combine(SetOperator.UNION, true, other); }
  public SetOperationQuery intersect(ActiveQuery other) { return combine(SetOperator.INTERSECT, false, other); }
  public SetOperationQuery except(ActiveQuery other) { return combine(SetOperator.EXCEPT, false, other); }

  private SetOperationQuery combine(SetOperator op, boolean all, ActiveQuery other) {
    requireSameBackend(backend(), other.backend());
    return new SetOperationQuery(ctx, model, SetOperation.of(op, all, operation, other.toPlan()), eagerLoads);
  }

  public SetOperationQuery orderBy(OrderItem... items) {
    List<OrderItem> order = new ArrayList<>(operation.orderBy());
    order.addAll(List.of(items));
    return new SetOperationQuery(ctx, model, operation.orderBy(order), eagerLoads);
  }

  public SetOperationQuery orderBy(String column) {
    return orderBy(col(column).asc());
  }

  public SetOperationQuery limit(long limit) {
    OffsetPage p = operation.page();
    return page(p == null ? OffsetPage.limit(limit) : p.withLimit(limit));
  }

  public SetOperationQuery offset(long offset) {
    OffsetPage p = operation.page();
    return page(p == null ? new OffsetPage(offset, null) : p.withOffset(offset));
  }

  private SetOperationQuery page(OffsetPage page) {
    return new SetOperationQuery(ctx, model, operation.page(page), eagerLoads);
  }

  public Backend backend() {
    return ctx.backendFor(model);
  }

  public SetOperation toPlan() { return operation; }

  public SqlStatement toSql() {
    return backend().dialect().compile(operation);
  }

  public List<ActiveRecord> all() {
    EagerLoader loader = ctx.eagerLoader();
    EagerLoadTree tree = loader.plan(model, eagerLoads);
    Backend b = backend();
    List<ActiveRecord> records = ctx.hydrator(model).hydrateAll(b.executor().query(toSql()));
    loader.load(tree, records);
    return records;
  }

  public CompletableFuture<List<ActiveRecord>> allAsync() {
    EagerLoader loader = ctx.eagerLoader();
    EagerLoadTree tree = loader.plan(model, eagerLoads);
    Backend b = backend();
    SqlStatement st = toSql();
    RecordHydrator hydrator = ctx.hydrator(model);
    return loader.fetchThenLoad(b.requireAsync().queryAsync(st).thenApply(hydrator::hydrateAll), tree);
  }

  /** Rows as label/value maps, without hydration. */
  public List<Map<String, Object>> aggregate() {
    return ActiveQuery.toMaps(backend().executor().query(toSql()));
  }
}
