package io.intellixity.activa.persistence.capability;

public enum PaginationCapability implements Capability {
  LIMIT_OFFSET, OFFSET_FETCH;

  @Override public CapabilityCategory category() { return CapabilityCategory.PAGINATION; }
}
