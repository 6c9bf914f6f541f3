package io.intellixity.activa.persistence.capability;

/**
 * The target dialect (at its detected server version) cannot express a construct used by the plan.
 * Raised at compile time; there is no automatic fallback to a different SQL shape.
 */
public final class UnsupportedFeatureException extends RuntimeException {
  private final String dialectId;
  private final String feature;

  public UnsupportedFeatureException(String dialectId, String feature) {
    this(dialectId, feature, null);
  }

  public UnsupportedFeatureException(String dialectId, String feature, String suggestion) {
    super("'" + dialectId + "' dialect does not support " + feature +
        (suggestion == null || suggestion.isBlank() ? "" : ". Suggestion: " + suggestion));
    this.dialectId = dialectId;
    this.feature = feature;
  }

  public String dialectId() { return dialectId; }
  public String feature() { return feature; }
}
