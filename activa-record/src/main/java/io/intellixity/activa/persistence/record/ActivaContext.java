package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.relation.RelationCacheConfig;
import io.intellixity.activa.persistence.spi.exec.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point tying models to backends. The first registered backend is the default for models
 * that do not name one.
 */
public final class ActivaContext {
  private static final Logger log = LoggerFactory.getLogger(ActivaContext.class);

  private final ModelRegistry models;
  private final RelationCacheConfig cacheConfig;
  private volatile Map<String, Backend> backends = Map.of();
  private volatile String defaultBackendId;

  public ActivaContext(ModelRegistry models) {
    this(models, RelationCacheConfig.defaults());
  }

  public ActivaContext(ModelRegistry models, RelationCacheConfig cacheConfig) {
    this.models = Objects.requireNonNull(models, "models");
    this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig");
  }

  public synchronized ActivaContext register(Backend backend) {
    Objects.requireNonNull(backend, "backend");
    Map<String, Backend> next = new HashMap<>(backends);
    if (next.put(backend.id(), backend) != null) {
      log.warn("activa.context op=register backend={} replaced=true", backend.id());
    }
    backends = Map.copyOf(next);
    if (defaultBackendId == null) defaultBackendId = backend.id();
    return this;
  }

  public synchronized ActivaContext defaultBackend(String backendId) {
    backend(backendId);
    this.defaultBackendId = backendId;
    return this;
  }

  public Backend backend(String id) {
    Backend b = backends.get(id);
    if (b == null) throw new IllegalArgumentException("Unknown backend: " + id);
    return b;
  }

  public Backend backendFor(ModelDescriptor model) {
    String id = model.backendId() != null ? model.backendId() : defaultBackendId;
    if (id == null) throw new IllegalStateException("No backend registered for model '" + model.name() + "'");
    return backend(id);
  }

  public ModelRegistry models() { return models; }
  public RelationCacheConfig cacheConfig() { return cacheConfig; }

  public ActiveQuery query(String model) {
    return query(models.get(model));
  }

  public ActiveQuery query(ModelDescriptor model) {
    return ActiveQuery.of(this, model);
  }

  public EagerLoader eagerLoader() {
    return new EagerLoader(this);
  }

  public RelationAccessor relations() {
    return new RelationAccessor(this);
  }

  RecordHydrator hydrator(ModelDescriptor model) {
    return new RecordHydrator(model, backendFor(model).types(), cacheConfig);
  }
}
