package io.intellixity.activa.persistence.plan;

import java.util.Objects;

/** A table, view or CTE name. */
public record TableSource(String name, String alias) implements Source {
  public TableSource {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("table name must not be blank");
    alias = (alias == null || alias.isBlank()) ? null : alias;
  }

  public static TableSource of(String name) { return new TableSource(name, null); }

  public TableSource as(String alias) { return new TableSource(name, alias); }

  @Override public String referenceName() { return alias != null ? alias : name; }
}
