package io.intellixity.activa.persistence.compile;

import io.intellixity.activa.persistence.plan.*;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Structural checks shared by every dialect, run before any SQL is rendered. Validation walks the
 * whole tree: CTE bodies, set-operation operands at any depth and derived tables in FROM/JOIN.
 */
public final class PlanValidator {
  private PlanValidator() {}

  public static void validate(Queryable q) {
    if (q instanceof QueryPlan p) validatePlan(p);
    else if (q instanceof SetOperation s) validateSetOperation(s);
    else throw new IllegalArgumentException("Unknown Queryable: " + (q == null ? "null" : q.getClass().getName()));
  }

  private static void validatePlan(QueryPlan p) {
    if (p.having() != null && p.groupBy().isEmpty()) {
      throw new InvalidPlanException("HAVING requires GROUP BY");
    }

    Set<String> cteNames = new HashSet<>();
    for (CommonTableExpression cte : p.ctes()) {
      if (!cteNames.add(cte.name().toLowerCase(Locale.ROOT))) {
        throw new InvalidPlanException("Duplicate CTE name '" + cte.name() + "'");
      }
      validate(cte.query());
      int arity = cte.query().arity();
      if (!cte.columns().isEmpty() && arity != Queryable.UNKNOWN_ARITY && arity != cte.columns().size()) {
        throw new InvalidPlanException("CTE '" + cte.name() + "' declares " + cte.columns().size()
            + " columns but its query returns " + arity);
      }
      if (!references(cte.query(), cte.name())) continue;
      if (!p.recursive()) {
        throw new InvalidPlanException("CTE '" + cte.name() + "' references itself but the query is not marked recursive");
      }
      if (!(cte.query() instanceof SetOperation so) || so.operator() != SetOperator.UNION) {
        throw new InvalidPlanException("Recursive CTE '" + cte.name() + "' must be a UNION or UNION ALL of an anchor and a recursive member");
      }
    }

    validateSource(p.from());
    Set<String> refs = new HashSet<>();
    refs.add(p.from().referenceName().toLowerCase(Locale.ROOT));
    for (JoinClause j : p.joins()) {
      validateSource(j.target());
      if (j.kind() == JoinKind.CROSS && j.on() != null) {
        throw new InvalidPlanException("CROSS JOIN must not have an ON condition");
      }
      if (j.kind() != JoinKind.CROSS && j.on() == null) {
        throw new InvalidPlanException(j.kind() + " join on '" + j.target().referenceName() + "' requires an ON condition");
      }
      if (!refs.add(j.target().referenceName().toLowerCase(Locale.ROOT))) {
        throw new InvalidPlanException("Join target '" + j.target().referenceName() +
            "' is ambiguous; self-joins require a distinct alias");
      }
    }
  }

  private static void validateSource(Source source) {
    if (source instanceof SubquerySource sq) validate(sq.query());
  }

  private static void validateSetOperation(SetOperation s) {
    checkOperand(s, s.left());
    checkOperand(s, s.right());
    validate(s.left());
    validate(s.right());
    int l = s.left().arity();
    int r = s.right().arity();
    if (l != Queryable.UNKNOWN_ARITY && r != Queryable.UNKNOWN_ARITY && l != r) {
      throw new ArityMismatchException(s.operator(), l, r);
    }
  }

  private static void checkOperand(SetOperation s, Queryable operand) {
    boolean ordered = false;
    if (operand instanceof QueryPlan p) ordered = !p.orderBy().isEmpty() || p.page() != null;
    else if (operand instanceof SetOperation nested) ordered = !nested.orderBy().isEmpty() || nested.page() != null;
    if (ordered) {
      throw new InvalidPlanException(s.operator() + " operands must not carry ORDER BY or LIMIT; apply them to the outermost set operation");
    }
  }

  /** True when {@code q} reads from a source named {@code name} in its FROM/JOIN tree. */
  public static boolean references(Queryable q, String name) {
    if (q instanceof SetOperation s) return references(s.left(), name) || references(s.right(), name);
    if (!(q instanceof QueryPlan p)) return false;
    if (sourceReferences(p.from(), name)) return true;
    for (JoinClause j : p.joins()) {
      if (sourceReferences(j.target(), name)) return true;
    }
    return false;
  }

  private static boolean sourceReferences(Source s, String name) {
    if (s instanceof TableSource t) return t.name().equalsIgnoreCase(name);
    if (s instanceof SubquerySource sq) return references(sq.query(), name);
    return false;
  }
}
