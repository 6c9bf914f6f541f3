package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.relation.CrossBackendRelation;
import io.intellixity.activa.persistence.relation.RelationDescriptor;
import io.intellixity.activa.persistence.relation.RelationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static io.intellixity.activa.persistence.expr.Expressions.col;

/**
 * Batched relation loader. Each node of the load tree costs one query over the keys of the whole
 * parent set; nodes whose parents yield no keys cost none.
 *
 * <p>Levels run strictly top-down. In the async path, siblings of one level are issued together
 * only when every backend involved accepts concurrent statements. Cancelling the returned future
 * stops further batches; relations not yet attached stay NOT_LOADED.</p>
 */
public final class EagerLoader {
  private static final Logger log = LoggerFactory.getLogger(EagerLoader.class);

  private final ActivaContext ctx;

  EagerLoader(ActivaContext ctx) {
    this.ctx = ctx;
  }

  private record Pending(EagerLoadTree.Node node, List<ActiveRecord> parents) {}

  private static final class Progress {
    final AtomicInteger queries = new AtomicInteger();
    final List<CrossBackendRelation> crossBackend = new CopyOnWriteArrayList<>();
    final long startNanos = System.nanoTime();

    EagerLoadReport report() {
      return new EagerLoadReport(queries.get(), crossBackend);
    }

    long elapsedMs() {
      return (System.nanoTime() - startNanos) / 1_000_000L;
    }
  }

  /** Resolves {@code loads} against the registry; unknown relations fail here, before any query. */
  EagerLoadTree plan(ModelDescriptor root, List<EagerLoad> loads) {
    return EagerLoadTree.build(ctx.models(), root, loads);
  }

  public EagerLoadReport load(ModelDescriptor root, List<ActiveRecord> parents, List<EagerLoad> loads) {
    return load(plan(root, loads), parents);
  }

  public CompletableFuture<EagerLoadReport> loadAsync(ModelDescriptor root, List<ActiveRecord> parents,
                                                      List<EagerLoad> loads) {
    return loadAsync(plan(root, loads), parents);
  }

  EagerLoadReport load(EagerLoadTree tree, List<ActiveRecord> parents) {
    if (tree.isEmpty()) return EagerLoadReport.empty();
    Progress progress = new Progress();
    logStart(tree, parents);

    List<Pending> level = initial(tree, parents);
    while (!level.isEmpty()) {
      List<Pending> next = new ArrayList<>();
      for (Pending p : level) next.addAll(runBatch(p, progress));
      level = next;
    }

    EagerLoadReport report = progress.report();
    logDone(tree, report, progress);
    return report;
  }

  CompletableFuture<EagerLoadReport> loadAsync(EagerLoadTree tree, List<ActiveRecord> parents) {
    if (tree.isEmpty()) return CompletableFuture.completedFuture(EagerLoadReport.empty());
    Progress progress = new Progress();
    logStart(tree, parents);

    CompletableFuture<EagerLoadReport> result = new CompletableFuture<>();
    runLevelAsync(initial(tree, parents), progress, result).whenComplete((v, err) -> {
      if (result.isCancelled()) {
        log.info("activa.eager_cancelled model={} queries={}", tree.root().name(), progress.queries.get());
        return;
      }
      if (err != null) {
        result.completeExceptionally(unwrap(err));
        return;
      }
      EagerLoadReport report = progress.report();
      logDone(tree, report, progress);
      result.complete(report);
    });
    return result;
  }

  /**
   * Chains the eager loads onto a root fetch. Cancelling the returned future once the roots have
   * arrived cancels the load, so relations not yet attached stay NOT_LOADED.
   */
  CompletableFuture<List<ActiveRecord>> fetchThenLoad(CompletableFuture<List<ActiveRecord>> roots, EagerLoadTree tree) {
    CompletableFuture<List<ActiveRecord>> out = new CompletableFuture<>();
    AtomicReference<CompletableFuture<EagerLoadReport>> loading = new AtomicReference<>();
    roots.whenComplete((records, err) -> {
      if (err != null) {
        out.completeExceptionally(unwrap(err));
        return;
      }
      if (out.isDone()) return;
      CompletableFuture<EagerLoadReport> l = loadAsync(tree, records);
      loading.set(l);
      if (out.isCancelled()) l.cancel(false);
      l.whenComplete((report, e) -> {
        if (e != null) out.completeExceptionally(unwrap(e));
        else out.complete(records);
      });
    });
    out.whenComplete((v, e) -> {
      CompletableFuture<EagerLoadReport> l = loading.get();
      if (out.isCancelled() && l != null) l.cancel(false);
    });
    return out;
  }

  private static List<Pending> initial(EagerLoadTree tree, List<ActiveRecord> parents) {
    if (parents.isEmpty()) return List.of();
    List<Pending> out = new ArrayList<>();
    for (EagerLoadTree.Node n : tree.roots()) out.add(new Pending(n, parents));
    return out;
  }

  // ---- blocking ----

  private List<Pending> runBatch(Pending p, Progress progress) {
    List<Object> keys = keysOf(p);
    if (keys.isEmpty()) {
      attach(p, List.of());
      return List.of();
    }
    ActiveQuery q = batchQuery(p.node(), keys);
    issued(p.node(), progress);
    List<ActiveRecord> children = q.all();
    attach(p, children);
    return nextLevel(p.node(), children);
  }

  // ---- non-blocking ----

  private CompletableFuture<Void> runLevelAsync(List<Pending> level, Progress progress,
                                                CompletableFuture<EagerLoadReport> result) {
    if (level.isEmpty() || result.isDone()) return CompletableFuture.completedFuture(null);

    CompletableFuture<List<Pending>> next;
    if (concurrent(level)) {
      List<CompletableFuture<List<Pending>>> batches = new ArrayList<>();
      for (Pending p : level) batches.add(runBatchAsync(p, progress, result));
      next = CompletableFuture.allOf(batches.toArray(new CompletableFuture<?>[0])).thenApply(v -> {
        List<Pending> out = new ArrayList<>();
        for (CompletableFuture<List<Pending>> b : batches) out.addAll(b.join());
        return out;
      });
    } else {
      CompletableFuture<List<Pending>> chain = CompletableFuture.completedFuture(new ArrayList<>());
      for (Pending p : level) {
        chain = chain.thenCompose(acc -> runBatchAsync(p, progress, result).thenApply(more -> {
          acc.addAll(more);
          return acc;
        }));
      }
      next = chain;
    }
    return next.thenCompose(n -> runLevelAsync(n, progress, result));
  }

  private CompletableFuture<List<Pending>> runBatchAsync(Pending p, Progress progress,
                                                         CompletableFuture<EagerLoadReport> result) {
    if (result.isDone()) return CompletableFuture.completedFuture(List.of());
    List<Object> keys = keysOf(p);
    if (keys.isEmpty()) {
      attach(p, List.of());
      return CompletableFuture.completedFuture(List.of());
    }
    ActiveQuery q = batchQuery(p.node(), keys);
    issued(p.node(), progress);
    return q.allAsync().thenApply(children -> {
      if (result.isDone()) return List.<Pending>of();
      attach(p, children);
      return nextLevel(p.node(), children);
    });
  }

  private boolean concurrent(List<Pending> level) {
    if (level.size() < 2) return false;
    for (Pending p : level) {
      if (!ctx.backendFor(p.node().target).requireAsync().supportsConcurrentStatements()) return false;
    }
    return true;
  }

  // ---- shared planning and attachment ----

  private ActiveQuery batchQuery(EagerLoadTree.Node node, List<Object> keys) {
    RelationDescriptor r = node.relation;
    ActiveQuery q = ctx.query(node.target).where(col(columnOf(node.target, r.childKey())).in(keys));
    if (r.kind() == RelationKind.POLYMORPHIC) {
      q = q.where(columnOf(node.target, r.polymorphicTypeColumn()), r.polymorphicTypeValue());
    }
    if (node.modifier != null) q = node.modifier.apply(q);
    return q;
  }

  private void issued(EagerLoadTree.Node node, Progress progress) {
    progress.queries.incrementAndGet();
    String parentBackend = ctx.backendFor(node.owner).id();
    String childBackend = ctx.backendFor(node.target).id();
    if (!parentBackend.equals(childBackend)) {
      progress.crossBackend.add(new CrossBackendRelation(node.path, parentBackend, childBackend));
      log.warn("activa.eager op=cross_backend path={} parentBackend={} childBackend={}",
          node.path, parentBackend, childBackend);
    }
  }

  private static List<Object> keysOf(Pending p) {
    String key = p.node().relation.parentKey();
    Set<Object> keys = new LinkedHashSet<>();
    for (ActiveRecord parent : p.parents()) {
      Object k = KeyNormalizer.normalize(keyValue(parent, key));
      if (k != null) keys.add(k);
    }
    return new ArrayList<>(keys);
  }

  private static void attach(Pending p, List<ActiveRecord> children) {
    EagerLoadTree.Node node = p.node();
    RelationDescriptor r = node.relation;

    Map<Object, List<ActiveRecord>> byKey = new LinkedHashMap<>();
    for (ActiveRecord child : children) {
      Object k = KeyNormalizer.normalize(keyValue(child, r.childKey()));
      byKey.computeIfAbsent(k, x -> new ArrayList<>()).add(child);
    }

    String inverse = r.kind() == RelationKind.BELONGS_TO ? null : r.inverseOf();
    Duration inverseTtl = null;
    if (inverse != null && node.target.hasRelation(inverse)) inverseTtl = node.target.relation(inverse).cacheTtl();

    for (ActiveRecord parent : p.parents()) {
      Object k = KeyNormalizer.normalize(keyValue(parent, r.parentKey()));
      List<ActiveRecord> matched = k == null ? List.of() : byKey.getOrDefault(k, List.of());
      if (r.many()) {
        parent.relationCache().put(node.alias, List.copyOf(matched), r.cacheTtl());
      } else {
        parent.relationCache().put(node.alias, matched.isEmpty() ? null : matched.get(0), r.cacheTtl());
      }
      if (inverse != null) {
        for (ActiveRecord child : matched) child.relationCache().put(inverse, parent, inverseTtl);
      }
    }
  }

  private static List<Pending> nextLevel(EagerLoadTree.Node node, List<ActiveRecord> children) {
    if (children.isEmpty() || node.children.isEmpty()) return List.of();
    List<Pending> out = new ArrayList<>();
    for (EagerLoadTree.Node c : node.children) out.add(new Pending(c, children));
    return out;
  }

  static String columnOf(ModelDescriptor model, String key) {
    return model.field(key).map(FieldDef::column).orElse(key);
  }

  /** Value of a key field or column on {@code record}; labels are matched case-insensitively. */
  static Object keyValue(ActiveRecord record, String key) {
    String field = record.model().field(key).map(FieldDef::name)
        .or(() -> record.model().fieldForColumn(key).map(FieldDef::name))
        .orElse(key);
    if (record.has(field)) return record.get(field);
    for (Map.Entry<String, Object> e : record.values().entrySet()) {
      if (e.getKey().equalsIgnoreCase(field)) return e.getValue();
    }
    throw new IllegalStateException("Relation key '" + key + "' is not present on " + record.model().name()
        + " rows; include it in the projection");
  }

  private static Throwable unwrap(Throwable t) {
    return (t instanceof CompletionException && t.getCause() != null) ? t.getCause() : t;
  }

  private static void logStart(EagerLoadTree tree, List<ActiveRecord> parents) {
    log.info("activa.eager op=load model={} parents={} nodes={}", tree.root().name(), parents.size(), tree.size());
  }

  private static void logDone(EagerLoadTree tree, EagerLoadReport report, Progress progress) {
    log.info("activa.eager_done model={} queries={} crossBackend={} ms={}",
        tree.root().name(), report.queriesIssued(), report.crossBackend().size(), progress.elapsedMs());
  }
}
