package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.expr.Expression;
import io.intellixity.activa.persistence.expr.Expressions;
import io.intellixity.activa.persistence.expr.Functions;
import io.intellixity.activa.persistence.expr.OrderItem;
import io.intellixity.activa.persistence.mapping.Row;
import io.intellixity.activa.persistence.plan.CommonTableExpression;
import io.intellixity.activa.persistence.plan.InvalidPlanException;
import io.intellixity.activa.persistence.plan.JoinClause;
import io.intellixity.activa.persistence.plan.JoinKind;
import io.intellixity.activa.persistence.plan.Materialization;
import io.intellixity.activa.persistence.plan.OffsetPage;
import io.intellixity.activa.persistence.plan.QueryPlan;
import io.intellixity.activa.persistence.plan.Queryable;
import io.intellixity.activa.persistence.plan.SetOperation;
import io.intellixity.activa.persistence.plan.SetOperator;
import io.intellixity.activa.persistence.plan.Source;
import io.intellixity.activa.persistence.plan.SubquerySource;
import io.intellixity.activa.persistence.plan.TableSource;
import io.intellixity.activa.persistence.spi.exec.Backend;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static io.intellixity.activa.persistence.expr.Expressions.col;

/**
 * Immutable query builder for one model. Every method returns a new builder; the receiver is never
 * changed, so partially built queries can be shared and extended independently.
 *
 * <p>Compilation happens in {@link #toSql()} and the terminal methods, against the dialect of the
 * model's backend. Structural and capability errors surface there, before any statement is sent.</p>
 */
public final class ActiveQuery {
  /** Column added to guarded recursive CTEs; the anchor row is depth 1. */
  public static final String DEPTH_COLUMN = "activa_depth";

  private static final String COUNT_LABEL = "activa_count";
  private static final String EXISTS_LABEL = "activa_exists";

  private final ActivaContext ctx;
  private final ModelDescriptor model;
  private final QueryPlan plan;
  private final List<EagerLoad> eagerLoads;
  private final boolean explain;

  private ActiveQuery(ActivaContext ctx, ModelDescriptor model, QueryPlan plan, List<EagerLoad> eagerLoads,
                      boolean explain) {
    this.ctx = ctx;
    this.model = model;
    this.plan = plan;
    this.eagerLoads = List.copyOf(eagerLoads);
    this.explain = explain;
  }

  static ActiveQuery of(ActivaContext ctx, ModelDescriptor model) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(model, "model");
    return new ActiveQuery(ctx, model, QueryPlan.from(model.table()).build(), List.of(), false);
  }

  private ActiveQuery next(QueryPlan.Builder b) {
    return new ActiveQuery(ctx, model, b.build(), eagerLoads, explain);
  }

  public ModelDescriptor model() { return model; }
  public List<EagerLoad> eagerLoads() { return eagerLoads; }
  public boolean isExplain() { return explain; }

  public Backend backend() {
    return ctx.backendFor(model);
  }

  // ---- projection and filtering ----

  public ActiveQuery select(Expression... items) {
    return next(plan.toBuilder().select(items));
  }

  public ActiveQuery select(String... columns) {
    QueryPlan.Builder b = plan.toBuilder();
    for (String c : columns) b.select(col(c));
    return next(b);
  }

  public ActiveQuery where(Expression predicate) {
    return next(plan.toBuilder().andWhere(predicate));
  }

  /** Equality filter; {@code null} values compare with {@code IS NULL}. */
  public ActiveQuery where(Map<String, ?> filter) {
    if (filter == null || filter.isEmpty()) return this;
    return where(Expressions.allEq(filter));
  }

  public ActiveQuery where(String column, Object value) {
    return where(Expressions.eq(col(column), value));
  }

  /** {@code column IN (values)}; an empty collection matches nothing. */
  public ActiveQuery whereIn(String column, Collection<?> values) {
    return where(Expressions.in(col(column), values));
  }

  /** {@code column NOT IN (values)}; an empty collection matches everything. */
  public ActiveQuery whereNotIn(String column, Collection<?> values) {
    return where(Expressions.notIn(col(column), values));
  }

  /** Inclusive on both ends. */
  public ActiveQuery whereBetween(String column, Object low, Object high) {
    return where(Expressions.between(col(column), low, high));
  }

  public ActiveQuery whereNotBetween(String column, Object low, Object high) {
    return where(Expressions.notBetween(col(column), low, high));
  }

  public ActiveQuery whereLike(String column, String pattern) {
    return where(Expressions.like(col(column), pattern));
  }

  public ActiveQuery whereNull(String column) {
    return where(col(column).isNull());
  }

  public ActiveQuery whereNotNull(String column) {
    return where(col(column).isNotNull());
  }

  /** ORs {@code predicate} onto everything filtered so far. */
  public ActiveQuery orWhere(Expression predicate) {
    Objects.requireNonNull(predicate, "predicate");
    Expression current = plan.where();
    return next(plan.toBuilder().where(current == null ? predicate : current.or(predicate)));
  }

  public ActiveQuery orderBy(OrderItem... items) {
    return next(plan.toBuilder().orderBy(items));
  }

  public ActiveQuery orderBy(String column) {
    return orderBy(col(column).asc());
  }

  public ActiveQuery orderByDesc(String column) {
    return orderBy(col(column).desc());
  }

  public ActiveQuery limit(long limit) {
    return next(plan.toBuilder().limit(limit));
  }

  public ActiveQuery offset(long offset) {
    return next(plan.toBuilder().offset(offset));
  }

  public ActiveQuery groupBy(Expression... items) {
    return next(plan.toBuilder().groupBy(items));
  }

  public ActiveQuery groupBy(String... columns) {
    QueryPlan.Builder b = plan.toBuilder();
    for (String c : columns) b.groupBy(col(c));
    return next(b);
  }

  public ActiveQuery having(Expression predicate) {
    return next(plan.toBuilder().having(predicate));
  }

  public ActiveQuery distinct() {
    return next(plan.toBuilder().distinct(true));
  }

  // ---- joins ----

  public ActiveQuery join(Source target, Expression on) {
    return join(JoinKind.INNER, target, on);
  }

  public ActiveQuery join(String table, Expression on) {
    return join(JoinKind.INNER, TableSource.of(table), on);
  }

  public ActiveQuery leftJoin(Source target, Expression on) {
    return join(JoinKind.LEFT, target, on);
  }

  public ActiveQuery rightJoin(Source target, Expression on) {
    return join(JoinKind.RIGHT, target, on);
  }

  public ActiveQuery fullJoin(Source target, Expression on) {
    return join(JoinKind.FULL, target, on);
  }

  public ActiveQuery crossJoin(Source target) {
    return join(JoinKind.CROSS, target, null);
  }

  public ActiveQuery join(JoinKind kind, Source target, Expression on) {
    return next(plan.toBuilder().join(new JoinClause(kind, target, on)));
  }

  // ---- common table expressions ----

  public ActiveQuery withCte(String name, Queryable query) {
    return withCte(name, query, List.of(), null);
  }

  public ActiveQuery withCte(String name, ActiveQuery query) {
    return withCte(name, query.toPlan(), List.of(), null);
  }

  /**
   * Adds {@code name (columns) AS [NOT] MATERIALIZED (query)}. {@code materialized} null leaves the
   * choice to the backend.
   */
  public ActiveQuery withCte(String name, Queryable query, List<String> columns, Boolean materialized) {
    Materialization m = materialized == null ? Materialization.DEFAULT
        : materialized ? Materialization.MATERIALIZED : Materialization.NOT_MATERIALIZED;
    return next(plan.toBuilder().with(new CommonTableExpression(name, columns, query, m)));
  }

  public ActiveQuery recursive(boolean recursive) {
    return next(plan.toBuilder().recursive(recursive));
  }

  /**
   * Adds a recursive CTE {@code anchor UNION recursiveMember} and marks the query recursive.
   *
   * <p>With {@code maxDepth > 0} a {@value #DEPTH_COLUMN} column is appended to both members and the
   * recursive member stops at that depth, which bounds cyclic data. The anchor must then project
   * explicit columns and the recursive member must read from {@code name}.</p>
   */
  public ActiveQuery withRecursiveCte(String name, List<String> columns, QueryPlan anchor,
                                      QueryPlan recursiveMember, int maxDepth) {
    Objects.requireNonNull(anchor, "anchor");
    Objects.requireNonNull(recursiveMember, "recursiveMember");
    List<String> cteColumns = new ArrayList<>(columns == null ? List.of() : columns);
    QueryPlan a = anchor;
    QueryPlan r = recursiveMember;
    if (maxDepth > 0) {
      if (anchor.arity() == Queryable.UNKNOWN_ARITY) {
        throw new InvalidPlanException("Recursive CTE '" + name + "' with a depth guard needs an explicit anchor projection");
      }
      String ref = referenceTo(recursiveMember, name);
      a = anchor.toBuilder().select(Expressions.raw("1").as(DEPTH_COLUMN)).build();
      r = recursiveMember.toBuilder()
          .select(col(ref, DEPTH_COLUMN).plus(Expressions.raw("1")).as(DEPTH_COLUMN))
          .andWhere(col(ref, DEPTH_COLUMN).lt(maxDepth))
          .build();
      if (!cteColumns.isEmpty()) cteColumns.add(DEPTH_COLUMN);
    }
    SetOperation body = SetOperation.of(SetOperator.UNION, false, a, r);
    return next(plan.toBuilder()
        .with(new CommonTableExpression(name, cteColumns, body, Materialization.DEFAULT))
        .recursive(true));
  }

  private static String referenceTo(QueryPlan member, String cteName) {
    if (member.from() instanceof TableSource t && t.name().equalsIgnoreCase(cteName)) return t.referenceName();
    for (JoinClause j : member.joins()) {
      if (j.target() instanceof TableSource t && t.name().equalsIgnoreCase(cteName)) return t.referenceName();
    }
    throw new InvalidPlanException("Recursive member must read from CTE '" + cteName + "'");
  }

  /** Reads from {@code source} instead of the model's table, e.g. a CTE of the same shape. */
  public ActiveQuery from(Source source) {
    return next(plan.toBuilder().from(source));
  }

  // ---- eager loading ----

  public ActiveQuery with(String... paths) {
    List<EagerLoad> next = new ArrayList<>(eagerLoads);
    for (String p : paths) next.add(EagerLoad.of(p));
    return new ActiveQuery(ctx, model, plan, next, explain);
  }

  public ActiveQuery with(EagerLoad... loads) {
    List<EagerLoad> next = new ArrayList<>(eagerLoads);
    next.addAll(List.of(loads));
    return new ActiveQuery(ctx, model, plan, next, explain);
  }

  public ActiveQuery includes(String... paths) { return with(paths); }
  public ActiveQuery includes(EagerLoad... loads) { return with(loads); }

  // ---- set operations ----

  public SetOperationQuery union(ActiveQuery other) { return setOperation(SetOperator.UNION, false, other); }
  public SetOperationQuery unionAll(ActiveQuery other) { return setOperation(SetOperator.UNION, true, other); }
  public SetOperationQuery intersect(ActiveQuery other) { return setOperation(SetOperator.INTERSECT, false, other); }
  public SetOperationQuery intersectAll(ActiveQuery other) { return setOperation(SetOperator.INTERSECT, true, other); }
  public SetOperationQuery except(ActiveQuery other) { return setOperation(SetOperator.EXCEPT, false, other); }
  public SetOperationQuery exceptAll(ActiveQuery other) { return setOperation(SetOperator.EXCEPT, true, other); }

  private SetOperationQuery setOperation(SetOperator op, boolean all, ActiveQuery other) {
    SetOperationQuery.requireSameBackend(backend(), other.backend());
    return new SetOperationQuery(ctx, model, SetOperation.of(op, all, plan, other.plan), eagerLoads);
  }

  // ---- compilation ----

  public QueryPlan toPlan() { return plan; }

  public SqlStatement toSql() {
    return backend().dialect().compile(plan);
  }

  /** Makes the next {@link #aggregate()} return the backend's query plan instead of data. */
  public ActiveQuery explain() {
    return new ActiveQuery(ctx, model, plan, eagerLoads, true);
  }

  // ---- execution ----

  public List<ActiveRecord> all() {
    EagerLoader loader = ctx.eagerLoader();
    EagerLoadTree tree = loader.plan(model, eagerLoads);
    Backend b = backend();
    List<ActiveRecord> records = ctx.hydrator(model).hydrateAll(b.executor().query(b.dialect().compile(plan)));
    loader.load(tree, records);
    return records;
  }

  public Optional<ActiveRecord> one() {
    List<ActiveRecord> rows = firstOnly().all();
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Like {@link #one()} but throws {@link RecordNotFoundException} when nothing matches. */
  public ActiveRecord oneOrFail() {
    return one().orElseThrow(() -> new RecordNotFoundException(model.name()));
  }

  public boolean exists() {
    QueryPlan check = plan.page() != null
        ? wrap(Expressions.raw("1").as(EXISTS_LABEL), "activa_exists_src").toBuilder().limit(1).build()
        : plan.toBuilder().clearSelect().select(Expressions.raw("1").as(EXISTS_LABEL)).clearOrderBy().limit(1).build();
    Backend b = backend();
    return !b.executor().query(b.dialect().compile(check)).isEmpty();
  }

  public long count() {
    Backend b = backend();
    List<Row> rows = b.executor().query(b.dialect().compile(countPlan()));
    return rows.isEmpty() ? 0L : toLong(rows.get(0).raw(COUNT_LABEL));
  }

  /**
   * Runs the query with its current projection and returns the rows as label/value maps, e.g.
   * {@code groupBy("status").select(col("status"), count().as("n")).aggregate()}. After
   * {@link #explain()} the rows are the backend's EXPLAIN output.
   */
  public List<Map<String, Object>> aggregate() {
    Backend b = backend();
    SqlStatement st = explain ? b.dialect().compileExplain(plan) : b.dialect().compile(plan);
    return toMaps(b.executor().query(st));
  }

  public Object sum(String column) { return scalar(Functions.sum(col(column))); }
  public Object avg(String column) { return scalar(Functions.avg(col(column))); }
  public Object min(String column) { return scalar(Functions.min(col(column))); }
  public Object max(String column) { return scalar(Functions.max(col(column))); }

  private Object scalar(Expression aggregate) {
    QueryPlan p = plan.toBuilder().clearSelect().select(aggregate.as("activa_value")).clearOrderBy().build();
    Backend b = backend();
    List<Row> rows = b.executor().query(b.dialect().compile(p));
    return rows.isEmpty() ? null : rows.get(0).raw("activa_value");
  }

  public CompletableFuture<List<ActiveRecord>> allAsync() {
    EagerLoader loader = ctx.eagerLoader();
    EagerLoadTree tree = loader.plan(model, eagerLoads);
    Backend b = backend();
    SqlStatement st = b.dialect().compile(plan);
    RecordHydrator hydrator = ctx.hydrator(model);
    return loader.fetchThenLoad(b.requireAsync().queryAsync(st).thenApply(hydrator::hydrateAll), tree);
  }

  public CompletableFuture<Optional<ActiveRecord>> oneAsync() {
    return firstOnly().allAsync()
        .thenApply(rows -> rows.isEmpty() ? Optional.<ActiveRecord>empty() : Optional.of(rows.get(0)));
  }

  public CompletableFuture<List<Map<String, Object>>> aggregateAsync() {
    Backend b = backend();
    SqlStatement st = explain ? b.dialect().compileExplain(plan) : b.dialect().compile(plan);
    return b.requireAsync().queryAsync(st).thenApply(ActiveQuery::toMaps);
  }

  private ActiveQuery firstOnly() {
    OffsetPage page = plan.page();
    long limit = (page != null && page.hasLimit()) ? Math.min(page.limit(), 1L) : 1L;
    return next(plan.toBuilder().limit(limit));
  }

  private QueryPlan countPlan() {
    Expression count = Functions.count().as(COUNT_LABEL);
    if (plan.distinct() || !plan.groupBy().isEmpty() || plan.page() != null) {
      return wrap(count, "activa_count_src");
    }
    return plan.toBuilder().clearSelect().select(count).clearOrderBy().build();
  }

  /** {@code SELECT item FROM (plan) alias}, with CTEs hoisted to the outer query. */
  private QueryPlan wrap(Expression item, String alias) {
    List<OrderItem> order = plan.page() != null ? plan.orderBy() : List.of();
    QueryPlan inner = new QueryPlan(List.of(), false, plan.distinct(), plan.select(), plan.from(), plan.joins(),
        plan.where(), plan.groupBy(), plan.having(), order, plan.page());
    return new QueryPlan(plan.ctes(), plan.recursive(), false, List.of(item), new SubquerySource(inner, alias),
        List.of(), null, List.of(), null, List.of(), null);
  }

  static List<Map<String, Object>> toMaps(List<Row> rows) {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Row r : rows) out.add(new LinkedHashMap<>(r.toMap()));
    return out;
  }

  private static long toLong(Object v) {
    if (v == null) return 0L;
    if (v instanceof Number n) return n.longValue();
    return Long.parseLong(String.valueOf(v).trim());
  }

  @Override
  public String toString() {
    return "ActiveQuery[" + model.name() + "]";
  }
}
