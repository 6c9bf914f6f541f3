package io.intellixity.activa.persistence.spi.bind;

import io.intellixity.activa.persistence.compile.Bind;
import io.intellixity.activa.persistence.util.ActivaFactoriesLoader;

import java.util.ArrayList;
import java.util.List;

/**
 * Binders for one dialect, in lookup order: the dialect's own providers, then the providers that
 * apply to every dialect. Within each group provider order and binder order are kept.
 *
 * <p>A binder is chosen per bind: the first whose target and value types fit and whose
 * {@link Binder#supports} accepts the value. Null values skip the value-type check.</p>
 */
public final class DiscoveredBinderRegistry {
  public static final String GLOBAL_DIALECT = BinderProvider.ANY_DIALECT;

  private final String dialectId;
  private final List<Binder<?, ?>> lookupOrder;

  public DiscoveredBinderRegistry(String dialectId) {
    this(dialectId, ActivaFactoriesLoader.load(BinderProvider.class));
  }

  public DiscoveredBinderRegistry(String dialectId, List<BinderProvider> providers) {
    this.dialectId = dialectId == null ? "" : dialectId.trim();
    List<Binder<?, ?>> own = new ArrayList<>();
    List<Binder<?, ?>> shared = new ArrayList<>();
    for (BinderProvider p : providers) {
      if (p == null || p.binders() == null) continue;
      if (p.appliesToEveryDialect()) shared.addAll(p.binders());
      else if (p.serves(this.dialectId)) own.addAll(p.binders());
    }
    own.addAll(shared);
    this.lookupOrder = List.copyOf(own);
  }

  public String dialectId() { return dialectId; }

  public <TTarget> void bind(TTarget target, BindContext ctx, Bind bind, Object encodedValue) {
    if (target == null) throw new IllegalArgumentException("target is required");
    if (ctx == null || ctx.opKind() == null) throw new IllegalArgumentException("bind context with an opKind is required");
    Binder<TTarget, Object> binder = find(target, ctx, bind, encodedValue);
    if (binder == null) {
      throw new IllegalArgumentException("No binder for dialect '" + dialectId + "': target="
          + target.getClass().getName() + " value="
          + (encodedValue == null ? "null" : encodedValue.getClass().getName())
          + " columnType=" + ctx.columnType() + " op=" + ctx.opKind());
    }
    binder.bind(target, ctx, bind, encodedValue);
  }

  @SuppressWarnings("unchecked")
  private <TTarget> Binder<TTarget, Object> find(TTarget target, BindContext ctx, Bind bind, Object value) {
    for (Binder<?, ?> candidate : lookupOrder) {
      if (!candidate.targetType().isInstance(target)) continue;
      if (value != null && !candidate.valueType().isInstance(value)) continue;
      Binder<TTarget, Object> b = (Binder<TTarget, Object>) candidate;
      if (b.supports(ctx, bind, value)) return b;
    }
    return null;
  }
}
