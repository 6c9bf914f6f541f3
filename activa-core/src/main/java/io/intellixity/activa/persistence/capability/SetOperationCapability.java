package io.intellixity.activa.persistence.capability;

public enum SetOperationCapability implements Capability {
  UNION, UNION_ALL, INTERSECT, INTERSECT_ALL, EXCEPT, EXCEPT_ALL;

  @Override public CapabilityCategory category() { return CapabilityCategory.SET_OPERATIONS; }
}
