package io.intellixity.activa.persistence.plan;

/** CTE materialization hint. */
public enum Materialization {
  DEFAULT, MATERIALIZED, NOT_MATERIALIZED
}
