package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.relation.RelationDescriptor;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Models by name. Reads go through a copy-on-write snapshot; registration is synchronized.
 * Relation targets are checked lazily, when a relation is first resolved.
 */
public final class ModelRegistry {
  private volatile Map<String, ModelDescriptor> models = Map.of();

  public synchronized ModelRegistry register(ModelDescriptor model) {
    Map<String, ModelDescriptor> next = new HashMap<>(models);
    next.put(model.name(), model);
    models = Map.copyOf(next);
    return this;
  }

  public ModelDescriptor get(String name) {
    ModelDescriptor m = models.get(name);
    if (m == null) throw new IllegalArgumentException("Unknown model: " + name);
    return m;
  }

  public boolean contains(String name) {
    return models.containsKey(name);
  }

  public Collection<ModelDescriptor> all() {
    return models.values();
  }

  /** Target model of {@code relation}; fails when the relation points at an unregistered model. */
  public ModelDescriptor target(RelationDescriptor relation) {
    return get(relation.targetModel());
  }
}
