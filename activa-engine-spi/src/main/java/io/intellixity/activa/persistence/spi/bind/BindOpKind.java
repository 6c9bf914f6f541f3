package io.intellixity.activa.persistence.spi.bind;

public enum BindOpKind {
  QUERY, INSERT, UPDATE, DELETE
}
