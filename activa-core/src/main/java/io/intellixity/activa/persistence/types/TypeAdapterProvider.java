package io.intellixity.activa.persistence.types;

import java.util.Collection;

/**
 * Discovers {@link TypeAdapter}s through {@code META-INF/activa.factories}.
 *
 * <p>Providers are keyed by {@link #dialectId()}; {@code "*"} marks the global defaults. A dialect
 * provider's adapters are that dialect's suggestions and win over the global ones.</p>
 */
public interface TypeAdapterProvider {
  /** Dialect id this provider targets, or "*" for global. */
  String dialectId();

  Collection<TypeAdapter<?>> adapters();
}
