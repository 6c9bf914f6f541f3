package io.intellixity.activa.persistence.capability;

public enum JoinCapability implements Capability {
  INNER_JOIN, LEFT_JOIN, RIGHT_JOIN, FULL_JOIN, CROSS_JOIN;

  @Override public CapabilityCategory category() { return CapabilityCategory.JOINS; }
}
