package io.intellixity.activa.persistence.capability;

import java.util.Locale;

public enum WindowFunctionCapability implements Capability {
  ROW_NUMBER, RANK, DENSE_RANK, PERCENT_RANK, CUME_DIST, NTILE,
  LAG, LEAD, FIRST_VALUE, LAST_VALUE, NTH_VALUE,
  /** Aggregates (SUM, COUNT...) used with OVER. */
  AGGREGATE_OVER,
  /** ROWS/RANGE frame clauses. */
  WINDOW_FRAME;

  @Override public CapabilityCategory category() { return CapabilityCategory.WINDOW_FUNCTIONS; }

  /** Capability needed to call {@code functionName} with an OVER clause. */
  public static WindowFunctionCapability forFunction(String functionName) {
    String n = functionName.toUpperCase(Locale.ROOT);
    for (WindowFunctionCapability c : values()) {
      if (c.name().equals(n)) return c;
    }
    return AGGREGATE_OVER;
  }
}
