package io.intellixity.activa.persistence.capability;

import java.util.*;

/**
 * Immutable feature matrix of one backend: per category, a bitmask of supported capabilities.
 *
 * <p>Built once per backend from its detected {@link ServerVersion}. Adding a capability through the
 * builder also marks its category as supported.</p>
 */
public final class CapabilityDescriptor {
  private final String dialectId;
  private final ServerVersion version;
  private final Map<CapabilityCategory, Long> masks;

  private CapabilityDescriptor(String dialectId, ServerVersion version, Map<CapabilityCategory, Long> masks) {
    this.dialectId = dialectId;
    this.version = version;
    this.masks = Collections.unmodifiableMap(new EnumMap<>(masks));
  }

  public static Builder builder(String dialectId, ServerVersion version) {
    return new Builder(dialectId, version);
  }

  public String dialectId() { return dialectId; }
  public ServerVersion version() { return version; }

  public boolean supportsCategory(CapabilityCategory category) {
    return masks.getOrDefault(category, 0L) != 0L;
  }

  public boolean supports(Capability capability) {
    return (masks.getOrDefault(capability.category(), 0L) & capability.mask()) != 0L;
  }

  public boolean supports(CapabilityCategory category, Capability capability) {
    if (capability.category() != category) return false;
    return supports(capability);
  }

  public boolean supportsAll(Capability... capabilities) {
    for (Capability c : capabilities) {
      if (!supports(c)) return false;
    }
    return true;
  }

  /** Throws {@link UnsupportedFeatureException} unless {@code capability} is supported. */
  public void require(Capability capability, String feature) {
    require(capability, feature, null);
  }

  public void require(Capability capability, String feature, String suggestion) {
    if (!supports(capability)) {
      throw new UnsupportedFeatureException(dialectId, feature + " (requires " + capability.category() + "." +
          capability.name() + ", server " + version + ")", suggestion);
    }
  }

  /** Supported capability names per category, for diagnostics. */
  public Map<CapabilityCategory, List<String>> describe() {
    Map<CapabilityCategory, List<String>> out = new EnumMap<>(CapabilityCategory.class);
    for (Capability c : Builder.ALL) {
      if (supports(c)) out.computeIfAbsent(c.category(), k -> new ArrayList<>()).add(c.name());
    }
    return out;
  }

  public Builder toBuilder() {
    Builder b = new Builder(dialectId, version);
    b.masks.putAll(masks);
    return b;
  }

  @Override
  public String toString() {
    return "CapabilityDescriptor{" + dialectId + " " + version + " " + describe() + "}";
  }

  public static final class Builder {
    static final List<Capability> ALL;

    static {
      List<Capability> all = new ArrayList<>();
      all.addAll(List.of(SetOperationCapability.values()));
      all.addAll(List.of(WindowFunctionCapability.values()));
      all.addAll(List.of(CteCapability.values()));
      all.addAll(List.of(JoinCapability.values()));
      all.addAll(List.of(JsonCapability.values()));
      all.addAll(List.of(ReturningCapability.values()));
      all.addAll(List.of(PaginationCapability.values()));
      all.addAll(List.of(ExplainCapability.values()));
      ALL = List.copyOf(all);
    }

    private final String dialectId;
    private final ServerVersion version;
    private final Map<CapabilityCategory, Long> masks = new EnumMap<>(CapabilityCategory.class);

    private Builder(String dialectId, ServerVersion version) {
      this.dialectId = Objects.requireNonNull(dialectId, "dialectId");
      this.version = Objects.requireNonNull(version, "version");
    }

    public Builder add(Capability... capabilities) {
      for (Capability c : capabilities) {
        masks.merge(c.category(), c.mask(), (a, b) -> a | b);
      }
      return this;
    }

    /** Adds when {@code condition} holds; keeps version tables readable. */
    public Builder addIf(boolean condition, Capability... capabilities) {
      return condition ? add(capabilities) : this;
    }

    public Builder remove(Capability... capabilities) {
      for (Capability c : capabilities) {
        long next = masks.getOrDefault(c.category(), 0L) & ~c.mask();
        if (next == 0L) masks.remove(c.category());
        else masks.put(c.category(), next);
      }
      return this;
    }

    public CapabilityDescriptor build() {
      return new CapabilityDescriptor(dialectId, version, masks);
    }
  }
}
