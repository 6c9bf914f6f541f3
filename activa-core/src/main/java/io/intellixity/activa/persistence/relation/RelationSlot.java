package io.intellixity.activa.persistence.relation;

/**
 * State of one relation on one instance. {@code LOADED} with a {@code null} value is a valid state
 * ("loaded, no related row") and is distinct from {@link #NOT_LOADED}.
 */
public record RelationSlot(boolean loaded, Object value) {
  public static final RelationSlot NOT_LOADED = new RelationSlot(false, null);

  public RelationSlot {
    if (!loaded && value != null) throw new IllegalArgumentException("NOT_LOADED slot cannot hold a value");
  }

  public static RelationSlot loaded(Object value) {
    return new RelationSlot(true, value);
  }
}
