package io.intellixity.activa.persistence.capability;

public enum JsonCapability implements Capability {
  JSON_EXTRACT;

  @Override public CapabilityCategory category() { return CapabilityCategory.JSON_OPERATIONS; }
}
