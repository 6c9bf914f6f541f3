package io.intellixity.activa.persistence.spi.exec;

import io.intellixity.activa.persistence.mapping.Row;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;

import java.util.List;

/** Blocking execution of compiled statements against one backend. */
public interface QueryExecutor {
  String backendId();

  List<Row> query(SqlStatement statement);

  long update(SqlStatement statement);
}
