package io.intellixity.activa.persistence.jdbc.bind;

import io.intellixity.activa.persistence.spi.bind.BindOpKind;
import io.intellixity.activa.persistence.types.ColumnType;

public record ParameterSlot(BindOpKind opKind, int parameterIndex, ColumnType columnType) implements JdbcBindContext {
  public ParameterSlot {
    if (opKind == null) throw new IllegalArgumentException("opKind is required");
    if (parameterIndex < 1) throw new IllegalArgumentException("JDBC parameter indexes start at 1, got " + parameterIndex);
  }
}
