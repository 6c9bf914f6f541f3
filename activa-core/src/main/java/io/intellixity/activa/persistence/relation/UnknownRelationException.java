package io.intellixity.activa.persistence.relation;

/** A relation name (or path segment) is not declared on the model. Raised before any query is issued. */
public final class UnknownRelationException extends RuntimeException {
  private final String model;
  private final String relation;

  public UnknownRelationException(String model, String relation) {
    super("Unknown relation '" + relation + "' on model '" + model + "'");
    this.model = model;
    this.relation = relation;
  }

  public String model() { return model; }
  public String relation() { return relation; }
}
