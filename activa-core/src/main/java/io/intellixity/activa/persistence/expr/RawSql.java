package io.intellixity.activa.persistence.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Escape hatch: a SQL fragment emitted verbatim.
 *
 * <p>Each {@code ?} outside quoted text is a positional parameter and is rewritten to the dialect's
 * placeholder; {@code params} supplies their values in order.</p>
 */
public record RawSql(String sql, List<Object> params) implements Expression {
  public RawSql {
    Objects.requireNonNull(sql, "sql");
    // List.copyOf rejects null elements; raw params may legitimately be null.
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitRaw(this); }
}
