package io.intellixity.activa.persistence.spi.exec;

/** Backend failure while executing a compiled statement; the driver exception is the cause. */
public final class QueryExecutionException extends RuntimeException {
  private final String backendId;

  public QueryExecutionException(String backendId, String message, Throwable cause) {
    super("[" + backendId + "] " + message, cause);
    this.backendId = backendId;
  }

  public String backendId() { return backendId; }
}
