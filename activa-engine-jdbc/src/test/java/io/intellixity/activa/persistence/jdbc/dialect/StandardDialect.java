package io.intellixity.activa.persistence.jdbc.dialect;

import io.intellixity.activa.persistence.capability.*;
import io.intellixity.activa.persistence.spi.sql.PlaceholderStyle;

/** Plain ANSI rendering with every capability switched on unless removed. */
public final class StandardDialect extends AbstractJdbcSqlDialect {
  public StandardDialect() {
    this(full().build());
  }

  public StandardDialect(CapabilityDescriptor capabilities) {
    super("standard", capabilities);
  }

  public static CapabilityDescriptor.Builder full() {
    return CapabilityDescriptor.builder("standard", ServerVersion.of(1, 0))
        .add(SetOperationCapability.values())
        .add(CteCapability.values())
        .add(WindowFunctionCapability.values())
        .add(JoinCapability.values())
        .add(JsonCapability.values())
        .add(ReturningCapability.values())
        .add(PaginationCapability.LIMIT_OFFSET)
        .add(ExplainCapability.values());
  }

  @Override public String productName() { return "Standard"; }
  @Override public PlaceholderStyle placeholderStyle() { return PlaceholderStyle.QUESTION_MARK; }

  @Override protected String openQuote() { return "\""; }
  @Override protected String closeQuote() { return "\""; }
}
