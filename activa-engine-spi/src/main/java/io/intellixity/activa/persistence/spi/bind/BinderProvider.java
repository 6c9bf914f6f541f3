package io.intellixity.activa.persistence.spi.bind;

import java.util.Collection;

/**
 * Source of {@link Binder}s for one dialect, listed in {@code META-INF/activa.factories}.
 * Binders are tried in the order returned.
 */
public interface BinderProvider {
  String ANY_DIALECT = "*";

  /** Dialect id served by this provider; {@value #ANY_DIALECT}, blank or null apply to every dialect. */
  String dialectId();

  Collection<Binder<?, ?>> binders();

  default boolean appliesToEveryDialect() {
    String id = dialectId();
    return id == null || id.isBlank() || ANY_DIALECT.equals(id.trim());
  }

  default boolean serves(String dialect) {
    return !appliesToEveryDialect() && dialectId().trim().equals(dialect);
  }
}
