package io.intellixity.activa.persistence.plan;

/**
 * Anything that produces rows: a {@link QueryPlan} or a {@link SetOperation}. Usable as a subquery,
 * a CTE body or a set-operation operand.
 */
public interface Queryable {
  /** Number of projected columns, or {@link #UNKNOWN_ARITY} when it depends on the schema (e.g. {@code *}). */
  int arity();

  int UNKNOWN_ARITY = -1;
}
