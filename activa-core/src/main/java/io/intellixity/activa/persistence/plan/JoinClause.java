package io.intellixity.activa.persistence.plan;

import io.intellixity.activa.persistence.expr.Expression;

import java.util.Objects;

/**
 * Join target plus condition. Structural rules (ON required except for CROSS, aliases on
 * self-joins) are checked by the plan validator, not here, so partially built plans stay cheap.
 */
public record JoinClause(JoinKind kind, Source target, Expression on) {
  public JoinClause {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(target, "target");
  }
}
