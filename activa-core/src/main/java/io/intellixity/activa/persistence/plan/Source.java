package io.intellixity.activa.persistence.plan;

/** FROM / JOIN target. */
public interface Source {
  String alias();

  /** Name other clauses use to qualify columns of this source. */
  String referenceName();
}
