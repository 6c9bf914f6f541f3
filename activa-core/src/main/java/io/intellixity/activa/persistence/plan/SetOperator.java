package io.intellixity.activa.persistence.plan;

public enum SetOperator {
  UNION, INTERSECT, EXCEPT
}
