package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.relation.RelationCache;
import io.intellixity.activa.persistence.relation.RelationCacheConfig;
import io.intellixity.activa.persistence.relation.RelationSlot;
import io.intellixity.activa.persistence.relation.UnknownRelationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One loaded instance of a model: field values keyed by field name (unmapped columns keyed by
 * their label) plus a per-instance relation cache.
 */
public final class ActiveRecord {
  private final ModelDescriptor model;
  private final Map<String, Object> values;
  private final RelationCache relations;

  public ActiveRecord(ModelDescriptor model, Map<String, Object> values, RelationCacheConfig cacheConfig) {
    this.model = Objects.requireNonNull(model, "model");
    this.values = new LinkedHashMap<>(values == null ? Map.of() : values);
    this.relations = new RelationCache(cacheConfig);
  }

  public ModelDescriptor model() { return model; }

  public Object get(String field) {
    return values.get(field);
  }

  public <T> T get(String field, Class<T> type) {
    return type.cast(values.get(field));
  }

  public boolean has(String field) {
    return values.containsKey(field);
  }

  public Object id() {
    return values.get(model.primaryKey());
  }

  public Map<String, Object> values() {
    return Collections.unmodifiableMap(values);
  }

  /**
   * Copy of the field values restricted to {@code include} (all fields when null or empty) minus
   * {@code exclude}, in load order. Relations are not included.
   */
  public Map<String, Object> toMap(Collection<String> include, Collection<String> exclude) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : values.entrySet()) {
      if (include != null && !include.isEmpty() && !include.contains(e.getKey())) continue;
      if (exclude != null && exclude.contains(e.getKey())) continue;
      out.put(e.getKey(), e.getValue());
    }
    return out;
  }

  public RelationCache relationCache() { return relations; }

  public boolean isLoaded(String relation) {
    return relations.isLoaded(relation);
  }

  /** Loaded value of {@code relation}; use {@link RelationAccessor} for lazy loading. */
  public Object relation(String relation) {
    RelationSlot slot = relations.get(relation);
    if (!slot.loaded()) {
      throw new IllegalStateException("Relation '" + relation + "' is not loaded on " + model.name());
    }
    return slot.value();
  }

  @SuppressWarnings("unchecked")
  public List<ActiveRecord> many(String relation) {
    return (List<ActiveRecord>) relation(relation);
  }

  public ActiveRecord one(String relation) {
    return (ActiveRecord) relation(relation);
  }

  public void clearRelationCache() {
    relations.clearAll();
  }

  /** Clears one slot. {@code name} must be a declared relation or a currently loaded alias. */
  public void clearRelationCache(String name) {
    if (!model.hasRelation(name) && !relations.loadedNames().contains(name)) {
      throw new UnknownRelationException(model.name(), name);
    }
    relations.clear(name);
  }

  @Override
  public String toString() {
    return model.name() + values;
  }
}
