package io.intellixity.activa.persistence.relation;

public enum RelationKind {
  HAS_ONE(false),
  HAS_MANY(true),
  BELONGS_TO(false),
  /** Owning side of a polymorphic has-many: children carry (type, id) columns pointing at the owner. */
  POLYMORPHIC(true);

  private final boolean many;

  RelationKind(boolean many) {
    this.many = many;
  }

  public boolean many() { return many; }
}
