package io.intellixity.activa.persistence.jdbc.bind;

import java.sql.SQLException;

/** Driver refused a parameter value. */
public final class JdbcBindException extends RuntimeException {
  private final int parameterIndex;

  public JdbcBindException(int parameterIndex, SQLException cause) {
    super("Could not bind parameter " + parameterIndex + ": " + cause.getMessage(), cause);
    this.parameterIndex = parameterIndex;
  }

  public int parameterIndex() { return parameterIndex; }
}
