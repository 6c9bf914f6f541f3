package io.intellixity.activa.persistence.capability;

public enum CapabilityCategory {
  SET_OPERATIONS,
  WINDOW_FUNCTIONS,
  CTE,
  JOINS,
  JSON_OPERATIONS,
  RETURNING_CLAUSE,
  PAGINATION,
  EXPLAIN
}
