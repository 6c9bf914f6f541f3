package io.intellixity.activa.persistence.spi.bind;

import io.intellixity.activa.persistence.types.ColumnType;

/** Per-parameter binding context. Engines extend it with their own target coordinates. */
public interface BindContext {
  BindOpKind opKind();

  /** Storage class chosen by the resolved type adapter, or null when the value is null and untyped. */
  ColumnType columnType();
}
