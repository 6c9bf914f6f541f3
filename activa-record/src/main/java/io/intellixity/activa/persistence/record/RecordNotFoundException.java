package io.intellixity.activa.persistence.record;

/** A query that must return a record matched no rows. */
public final class RecordNotFoundException extends RuntimeException {
  private final String model;

  public RecordNotFoundException(String model) {
    super("No " + model + " record matched the query");
    this.model = model;
  }

  public String model() { return model; }
}
