package io.intellixity.activa.persistence.types;

import io.intellixity.activa.persistence.util.ActivaFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type adapter registry for one dialect, seeded by discovery (META-INF/activa.factories).
 *
 * <p>Resolution order for a Java type:</p>
 * <ol>
 *   <li>explicit per-field/per-value override passed by the caller</li>
 *   <li>adapters registered at runtime through {@link #register}</li>
 *   <li>dialect-suggested adapters (providers with this dialect id)</li>
 *   <li>global adapters (dialect id {@code "*"})</li>
 * </ol>
 * Within a layer the type itself is tried first, then its superclasses, then its interfaces.
 * Otherwise {@link UnregisteredTypeException}.
 *
 * <p>Reads are lock-free against a volatile snapshot; {@link #register} swaps in a new snapshot, so it
 * only affects binds made after it returns.</p>
 */
public final class TypeAdapterRegistry {
  private static final Logger log = LoggerFactory.getLogger(TypeAdapterRegistry.class);

  public static final String GLOBAL_DIALECT = "*";

  private final String dialectId;
  private volatile Snapshot snapshot;

  public TypeAdapterRegistry(String dialectId) {
    this(dialectId, ActivaFactoriesLoader.load(TypeAdapterProvider.class));
  }

  public TypeAdapterRegistry(String dialectId, List<TypeAdapterProvider> providers) {
    this.dialectId = (dialectId == null || dialectId.isBlank()) ? GLOBAL_DIALECT : dialectId;
    Map<Class<?>, TypeAdapter<?>> dialect = new LinkedHashMap<>();
    Map<Class<?>, TypeAdapter<?>> global = new LinkedHashMap<>();

    for (TypeAdapterProvider p : providers) {
      if (p == null || p.adapters() == null) continue;
      String did = normalizeDialect(p.dialectId());
      for (TypeAdapter<?> a : p.adapters()) {
        if (a == null) continue;
        if (GLOBAL_DIALECT.equals(did)) {
          global.putIfAbsent(a.javaType(), a);
        } else if (did.equals(this.dialectId)) {
          // first discovered wins, for determinism
          dialect.putIfAbsent(a.javaType(), a);
        }
      }
    }
    this.snapshot = new Snapshot(Map.of(), Map.copyOf(dialect), Map.copyOf(global));
  }

  public String dialectId() { return dialectId; }

  /** Registers (or replaces) the adapter for its Java type. Takes precedence over suggestions. */
  public synchronized void register(TypeAdapter<?> adapter) {
    Objects.requireNonNull(adapter, "adapter");
    Snapshot cur = snapshot;
    Map<Class<?>, TypeAdapter<?>> next = new LinkedHashMap<>(cur.registered);
    TypeAdapter<?> prev = next.put(adapter.javaType(), adapter);
    if (prev != null || cur.dialect.containsKey(adapter.javaType())) {
      log.warn("activa.types op=register dialectId={} javaType={} replaced={}",
          dialectId, adapter.javaType().getName(),
          (prev != null ? prev : cur.dialect.get(adapter.javaType())).getClass().getName());
    } else if (log.isDebugEnabled()) {
      log.debug("activa.types op=register dialectId={} javaType={} adapter={}",
          dialectId, adapter.javaType().getName(), adapter.getClass().getName());
    }
    snapshot = new Snapshot(Map.copyOf(next), cur.dialect, cur.global);
  }

  public Optional<TypeAdapter<?>> find(Class<?> javaType) {
    if (javaType == null) return Optional.empty();
    return Optional.ofNullable(snapshot.lookup(javaType));
  }

  public TypeAdapter<?> resolve(Class<?> javaType, AdapterDirection direction, TypeAdapter<?> override) {
    if (override != null) return override;
    TypeAdapter<?> a = (javaType == null) ? null : snapshot.lookup(javaType);
    if (a == null) throw new UnregisteredTypeException(javaType, direction, dialectId);
    return a;
  }

  /** Java value to driver value. {@code null} stays {@code null} without resolution. */
  public Object toDatabase(Object value, Class<?> declaredType, TypeAdapter<?> override) {
    if (value == null) return null;
    Class<?> type = (override != null) ? override.javaType() : (declaredType != null ? declaredType : value.getClass());
    @SuppressWarnings("unchecked")
    TypeAdapter<Object> a = (TypeAdapter<Object>) resolve(type, AdapterDirection.TO_DATABASE, override);
    return a.toDatabase(value, Map.of());
  }

  public Object toDatabase(Object value) {
    return toDatabase(value, null, null);
  }

  /** Driver value to {@code target}. {@code null} stays {@code null}. */
  public <T> T fromDatabase(Object raw, Class<T> target, TypeAdapter<?> override) {
    if (raw == null) return null;
    @SuppressWarnings("unchecked")
    TypeAdapter<Object> a = (TypeAdapter<Object>) resolve(target, AdapterDirection.FROM_DATABASE, override);
    Object v = a.fromDatabase(raw, target, Map.of());
    return cast(target, v);
  }

  public <T> T fromDatabase(Object raw, Class<T> target) {
    return fromDatabase(raw, target, null);
  }

  @SuppressWarnings("unchecked")
  private static <T> T cast(Class<T> target, Object v) {
    if (target.isPrimitive()) return (T) v;
    return target.cast(v);
  }

  private static String normalizeDialect(String did) {
    if (did == null) return GLOBAL_DIALECT;
    String s = did.trim();
    return s.isEmpty() ? GLOBAL_DIALECT : s;
  }

  private static final class Snapshot {
    final Map<Class<?>, TypeAdapter<?>> registered;
    final Map<Class<?>, TypeAdapter<?>> dialect;
    final Map<Class<?>, TypeAdapter<?>> global;
    final Map<Class<?>, Optional<TypeAdapter<?>>> resolved = new ConcurrentHashMap<>();

    Snapshot(Map<Class<?>, TypeAdapter<?>> registered, Map<Class<?>, TypeAdapter<?>> dialect,
             Map<Class<?>, TypeAdapter<?>> global) {
      this.registered = registered;
      this.dialect = dialect;
      this.global = global;
    }

    TypeAdapter<?> lookup(Class<?> javaType) {
      return resolved.computeIfAbsent(javaType, t -> Optional.ofNullable(search(t))).orElse(null);
    }

    private TypeAdapter<?> search(Class<?> javaType) {
      List<Class<?>> chain = hierarchy(boxed(javaType));
      for (Map<Class<?>, TypeAdapter<?>> layer : List.of(registered, dialect, global)) {
        for (Class<?> c : chain) {
          TypeAdapter<?> a = layer.get(c);
          if (a != null) return a;
        }
      }
      return null;
    }

    private static List<Class<?>> hierarchy(Class<?> type) {
      List<Class<?>> out = new ArrayList<>();
      for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) out.add(c);
      Deque<Class<?>> queue = new ArrayDeque<>(out);
      Set<Class<?>> seen = new HashSet<>(out);
      while (!queue.isEmpty()) {
        for (Class<?> i : queue.poll().getInterfaces()) {
          if (seen.add(i)) {
            out.add(i);
            queue.add(i);
          }
        }
      }
      out.add(Object.class);
      return out;
    }

    private static Class<?> boxed(Class<?> t) {
      if (!t.isPrimitive()) return t;
      if (t == int.class) return Integer.class;
      if (t == long.class) return Long.class;
      if (t == boolean.class) return Boolean.class;
      if (t == double.class) return Double.class;
      if (t == float.class) return Float.class;
      if (t == short.class) return Short.class;
      if (t == byte.class) return Byte.class;
      if (t == char.class) return Character.class;
      return t;
    }
  }
}
