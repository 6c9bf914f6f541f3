package io.intellixity.activa.persistence.capability;

public enum ExplainCapability implements Capability {
  EXPLAIN;

  @Override public CapabilityCategory category() { return CapabilityCategory.EXPLAIN; }
}
