package io.intellixity.activa.persistence.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/** Connection source of one backend, with the id of the dialect its statements are compiled for. */
public record JdbcHandle(String id, DataSource client, String dialectId) {
  public JdbcHandle {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(dialectId, "dialectId");
  }
}
