package io.intellixity.activa.persistence.spi.bind;

import io.intellixity.activa.persistence.compile.Bind;

/**
 * Applies an already adapter-encoded value to a native target (for JDBC, a PreparedStatement slot).
 * Binders only deal with driver specifics; value conversion belongs to type adapters.
 */
public interface Binder<TTarget, TValue> {
  Class<TTarget> targetType();

  Class<TValue> valueType();

  boolean supports(BindContext ctx, Bind bind, TValue encodedValue);

  void bind(TTarget target, BindContext ctx, Bind bind, TValue encodedValue);
}
