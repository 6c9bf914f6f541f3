package io.intellixity.activa.persistence.plan;

import java.util.Objects;

/** Derived table; an alias is mandatory on every supported backend. */
public record SubquerySource(Queryable query, String alias) implements Source {
  public SubquerySource {
    Objects.requireNonNull(query, "query");
    if (alias == null || alias.isBlank()) throw new InvalidPlanException("derived table requires an alias");
  }

  @Override public String referenceName() { return alias; }
}
