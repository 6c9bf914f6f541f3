package io.intellixity.activa.persistence.capability;

public enum ReturningCapability implements Capability {
  RETURNING_INSERT, RETURNING_UPDATE, RETURNING_DELETE;

  @Override public CapabilityCategory category() { return CapabilityCategory.RETURNING_CLAUSE; }
}
