package io.intellixity.activa.persistence.capability;

public enum CteCapability implements Capability {
  BASIC_CTE, RECURSIVE_CTE, MATERIALIZED_CTE;

  @Override public CapabilityCategory category() { return CapabilityCategory.CTE; }
}
