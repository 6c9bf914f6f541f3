package io.intellixity.activa.persistence.spi.sql;

import io.intellixity.activa.persistence.capability.CapabilityDescriptor;
import io.intellixity.activa.persistence.plan.DmlPlan;
import io.intellixity.activa.persistence.plan.Queryable;

/**
 * Backend-specific compiler from plans to parameterized SQL.
 *
 * <p>Implementations are stateless after construction and thread-safe. Compilation is deterministic:
 * the same plan compiled by the same dialect yields identical SQL and binds. Structural and
 * capability errors are raised here, before any I/O.</p>
 */
public interface Dialect {
  String id();

  CapabilityDescriptor capabilities();

  PlaceholderStyle placeholderStyle();

  SqlStatement compile(Queryable query);

  /** The dialect's EXPLAIN form of {@code query}. */
  SqlStatement compileExplain(Queryable query);

  SqlStatement compileDml(DmlPlan plan);

  /** Quotes {@code identifier} if the dialect requires it (reserved word or special characters). */
  String quoteIdentifier(String identifier);
}
