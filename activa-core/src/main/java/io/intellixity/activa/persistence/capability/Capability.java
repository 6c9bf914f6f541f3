package io.intellixity.activa.persistence.capability;

/**
 * A single feature flag inside a {@link CapabilityCategory}. Implemented by one enum per category;
 * the enum ordinal is the bit position in the category mask.
 */
public interface Capability {
  CapabilityCategory category();

  String name();

  int ordinal();

  default long mask() {
    return 1L << ordinal();
  }
}
