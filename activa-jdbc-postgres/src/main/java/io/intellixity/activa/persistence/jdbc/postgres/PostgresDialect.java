package io.intellixity.activa.persistence.jdbc.postgres;

import io.intellixity.activa.persistence.capability.*;
import io.intellixity.activa.persistence.compile.Bind;
import io.intellixity.activa.persistence.expr.Expression;
import io.intellixity.activa.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.activa.persistence.jdbc.dialect.ReservedWords;
import io.intellixity.activa.persistence.spi.sql.PlaceholderStyle;

import java.util.Map;
import java.util.Set;

/**
 * Postgres dialect implementation for JDBC.
 *
 * <p>Keeps only Postgres-specific overrides. Generic SQL rendering lives in
 * {@link AbstractJdbcSqlDialect}.</p>
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "postgres";

  private static final Set<String> RESERVED = ReservedWords.with(
      "ANALYSE", "ANALYZE", "ARRAY", "ASYMMETRIC", "AUTHORIZATION", "BINARY", "BOTH", "COLLATE",
      "CONCURRENTLY", "CURRENT_ROLE", "DEFERRABLE", "DO", "FREEZE", "ILIKE", "INITIALLY", "ISNULL",
      "LATERAL", "LEADING", "LIMIT", "LOCALTIME", "LOCALTIMESTAMP", "NOTNULL", "OFFSET", "ONLY",
      "OVERLAPS", "PLACING", "RETURNING", "SESSION_USER", "SIMILAR", "SYMMETRIC", "TABLESAMPLE",
      "TRAILING", "VARIADIC", "VERBOSE", "WINDOW");

  private static final Map<String, String> FUNCTIONS = Map.of(
      "IFNULL", "COALESCE",
      "NVL", "COALESCE",
      "ISNULL", "COALESCE",
      "LEN", "LENGTH",
      "GETDATE", "NOW",
      "SYSTIMESTAMP", "NOW");

  public PostgresDialect(ServerVersion version) {
    super(ID, capabilitiesFor(version));
  }

  /** Everything except MATERIALIZED hints (12) and jsonb extraction (9.4) is available on supported servers. */
  public static CapabilityDescriptor capabilitiesFor(ServerVersion v) {
    return CapabilityDescriptor.builder(ID, v)
        .add(SetOperationCapability.values())
        .add(CteCapability.BASIC_CTE, CteCapability.RECURSIVE_CTE)
        .addIf(v.atLeast(12, 0), CteCapability.MATERIALIZED_CTE)
        .add(WindowFunctionCapability.values())
        .add(JoinCapability.values())
        .addIf(v.atLeast(9, 4), JsonCapability.JSON_EXTRACT)
        .add(ReturningCapability.values())
        .add(PaginationCapability.LIMIT_OFFSET, PaginationCapability.OFFSET_FETCH)
        .add(ExplainCapability.EXPLAIN)
        .build();
  }

  @Override public String productName() { return "PostgreSQL"; }
  @Override public PlaceholderStyle placeholderStyle() { return PlaceholderStyle.DOLLAR_NUMBERED; }

  @Override protected String openQuote() { return "\""; }
  @Override protected String closeQuote() { return "\""; }
  @Override protected Set<String> reservedWords() { return RESERVED; }
  @Override protected Map<String, String> functionNames() { return FUNCTIONS; }

  /** Unquoted identifiers fold to lower case, so mixed-case names must be quoted to survive. */
  @Override
  protected boolean needsQuoting(String identifier) {
    if (super.needsQuoting(identifier)) return true;
    for (int i = 0; i < identifier.length(); i++) {
      if (Character.isUpperCase(identifier.charAt(i))) return true;
    }
    return false;
  }

  /** {@code jsonb_extract_path_text(CAST(doc AS jsonb), $n, ...)}; each path segment is its own bind. */
  @Override
  protected String renderJsonExtract(String document, Expression path, RenderCtx ctx, ExprRenderer r) {
    StringBuilder sb = new StringBuilder("jsonb_extract_path_text(CAST(").append(document).append(" AS jsonb)");
    for (String segment : jsonPathSegments(path)) sb.append(", ").append(ctx.add(Bind.of(segment)));
    return sb.append(')').toString();
  }
}
