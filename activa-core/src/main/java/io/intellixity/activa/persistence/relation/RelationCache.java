package io.intellixity.activa.persistence.relation;

import java.time.Duration;
import java.util.*;
import java.util.function.LongSupplier;

/**
 * Per-instance relation cache with expire-after-write.
 *
 * <p>Slots are never invalidated implicitly by writes to the owning instance; callers clear them
 * explicitly or let them expire. An expired slot reads as {@link RelationSlot#NOT_LOADED}.</p>
 */
public final class RelationCache {
  private final RelationCacheConfig config;
  private final LongSupplier nowMillis;
  private final Map<String, Entry> slots = new LinkedHashMap<>();

  private static final class Entry {
    final Object value;
    final long expiresAt;

    Entry(Object value, long expiresAt) {
      this.value = value;
      this.expiresAt = expiresAt;
    }
  }

  public RelationCache(RelationCacheConfig config) {
    this(config, System::currentTimeMillis);
  }

  public RelationCache(RelationCacheConfig config, LongSupplier nowMillis) {
    this.config = Objects.requireNonNull(config, "config");
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public synchronized RelationSlot get(String name) {
    Objects.requireNonNull(name, "name");
    Entry e = slots.get(name);
    if (e == null) return RelationSlot.NOT_LOADED;
    if (isExpired(e, nowMillis.getAsLong())) {
      slots.remove(name);
      return RelationSlot.NOT_LOADED;
    }
    return RelationSlot.loaded(e.value);
  }

  public boolean isLoaded(String name) {
    return get(name).loaded();
  }

  /** Stores {@code value} under {@code name}. {@code ttl} null means the configured default. */
  public synchronized void put(String name, Object value, Duration ttl) {
    Objects.requireNonNull(name, "name");
    long now = nowMillis.getAsLong();
    slots.put(name, new Entry(value, expiryFor(ttl, now)));
  }

  public void put(String name, Object value) {
    put(name, value, null);
  }

  public synchronized void clear(String name) {
    slots.remove(name);
  }

  public synchronized void clearAll() {
    slots.clear();
  }

  /** Names whose slot is currently LOADED. */
  public synchronized Set<String> loadedNames() {
    long now = nowMillis.getAsLong();
    slots.values().removeIf(e -> isExpired(e, now));
    return Set.copyOf(slots.keySet());
  }

  private long expiryFor(Duration ttl, long now) {
    if (!config.expiryEnabled()) return Long.MAX_VALUE;
    Duration effective = (ttl != null) ? ttl : config.defaultTtl();
    if (effective.isZero()) return Long.MAX_VALUE;
    long millis = effective.toMillis();
    return (Long.MAX_VALUE - now < millis) ? Long.MAX_VALUE : now + millis;
  }

  private static boolean isExpired(Entry e, long now) {
    return now >= e.expiresAt;
  }
}
