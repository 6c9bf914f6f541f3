package io.intellixity.activa.persistence.relation;

import java.time.Duration;

/**
 * Relation cache settings. With expiry disabled, loaded relations stay until cleared explicitly.
 * A relation's own {@code cacheTtl} overrides {@code defaultTtl}; a zero TTL never expires.
 */
public record RelationCacheConfig(boolean expiryEnabled, Duration defaultTtl) {
  public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

  public RelationCacheConfig {
    defaultTtl = defaultTtl == null ? DEFAULT_TTL : defaultTtl;
    if (defaultTtl.isNegative()) throw new IllegalArgumentException("defaultTtl must be >= 0");
  }

  public static RelationCacheConfig defaults() {
    return new RelationCacheConfig(true, DEFAULT_TTL);
  }

  public static RelationCacheConfig noExpiry() {
    return new RelationCacheConfig(false, DEFAULT_TTL);
  }
}
