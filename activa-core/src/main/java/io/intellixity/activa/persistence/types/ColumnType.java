package io.intellixity.activa.persistence.types;

/** Backend-neutral storage class an adapter writes to. Binders use it to pick driver-specific binding. */
public enum ColumnType {
  TEXT,
  INTEGER,
  BIGINT,
  DOUBLE,
  DECIMAL,
  BOOLEAN,
  DATE,
  TIMESTAMP,
  UUID,
  JSON,
  BLOB,
  OTHER
}
