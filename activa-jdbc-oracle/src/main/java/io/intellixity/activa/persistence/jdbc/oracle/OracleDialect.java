package io.intellixity.activa.persistence.jdbc.oracle;

import io.intellixity.activa.persistence.capability.*;
import io.intellixity.activa.persistence.expr.Expression;
import io.intellixity.activa.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.activa.persistence.jdbc.dialect.ReservedWords;
import io.intellixity.activa.persistence.plan.OffsetPage;
import io.intellixity.activa.persistence.plan.SetOperator;
import io.intellixity.activa.persistence.spi.sql.PlaceholderStyle;

import java.util.Map;
import java.util.Set;

/**
 * Oracle dialect implementation for JDBC.
 *
 * <p>Differences from the generic rendering:</p>
 * <ul>
 *   <li>recursive CTEs have no RECURSIVE keyword</li>
 *   <li>EXCEPT is spelled MINUS</li>
 *   <li>12c+ pages with OFFSET/FETCH; older servers get a ROWNUM wrapper that adds an
 *       {@code activa_rn} column when an offset is present</li>
 * </ul>
 */
public final class OracleDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "oracle";

  private static final Set<String> RESERVED = ReservedWords.with(
      "ACCESS", "ADD", "AUDIT", "CHAR", "CLUSTER", "COMMENT", "COMPRESS", "CONNECT", "CURRENT", "DATE",
      "DECIMAL", "EXCLUSIVE", "FILE", "FLOAT", "IDENTIFIED", "IMMEDIATE", "INCREMENT", "INDEX", "INITIAL",
      "INTEGER", "LEVEL", "LOCK", "LONG", "MAXEXTENTS", "MINUS", "MLSLABEL", "MODE", "MODIFY", "NOAUDIT",
      "NOCOMPRESS", "NOWAIT", "NUMBER", "OFFLINE", "ONLINE", "OPTION", "PCTFREE", "PRIOR", "PRIVILEGES",
      "PUBLIC", "RAW", "RENAME", "RESOURCE", "REVOKE", "ROW", "ROWID", "ROWNUM", "ROWS", "SESSION", "SHARE",
      "SIZE", "SMALLINT", "START", "SUCCESSFUL", "SYNONYM", "SYSDATE", "TRIGGER", "UID", "VALIDATE",
      "VARCHAR", "VARCHAR2", "VIEW", "WHENEVER");

  private static final Map<String, String> FUNCTIONS = Map.of(
      "IFNULL", "NVL",
      "ISNULL", "NVL",
      "LEN", "LENGTH",
      "SUBSTRING", "SUBSTR",
      "NOW", "SYSTIMESTAMP",
      "GETDATE", "SYSTIMESTAMP");

  private final boolean offsetFetch;

  public OracleDialect(ServerVersion version) {
    super(ID, capabilitiesFor(version));
    this.offsetFetch = capabilities().supports(PaginationCapability.OFFSET_FETCH);
  }

  /** Recursive CTEs 11.2, OFFSET/FETCH and JSON_VALUE 12.1, INTERSECT ALL / MINUS ALL 21; no RETURNING result sets. */
  public static CapabilityDescriptor capabilitiesFor(ServerVersion v) {
    return CapabilityDescriptor.builder(ID, v)
        .add(SetOperationCapability.UNION, SetOperationCapability.UNION_ALL,
            SetOperationCapability.INTERSECT, SetOperationCapability.EXCEPT)
        .addIf(v.atLeast(21, 0), SetOperationCapability.INTERSECT_ALL, SetOperationCapability.EXCEPT_ALL)
        .add(CteCapability.BASIC_CTE)
        .addIf(v.atLeast(11, 2), CteCapability.RECURSIVE_CTE)
        .add(WindowFunctionCapability.values())
        .add(JoinCapability.values())
        .addIf(v.atLeast(12, 1), JsonCapability.JSON_EXTRACT)
        .addIf(v.atLeast(12, 1), PaginationCapability.OFFSET_FETCH)
        .add(ExplainCapability.EXPLAIN)
        .build();
  }

  @Override public String productName() { return "Oracle"; }
  @Override public PlaceholderStyle placeholderStyle() { return PlaceholderStyle.COLON_NAMED; }

  @Override protected String openQuote() { return "\""; }
  @Override protected String closeQuote() { return "\""; }
  @Override protected Set<String> reservedWords() { return RESERVED; }
  @Override protected Map<String, String> functionNames() { return FUNCTIONS; }
  @Override protected String recursiveKeyword() { return ""; }
  @Override protected String explainPrefix() { return "EXPLAIN PLAN FOR"; }

  @Override
  protected String setOperatorKeyword(SetOperator op) {
    return op == SetOperator.EXCEPT ? "MINUS" : op.name();
  }

  @Override
  protected String applyPage(SelectParts parts, OffsetPage page, RenderCtx ctx) {
    if (offsetFetch) return applyOffsetFetch(parts, page);
    if (!page.hasOffset()) {
      if (!page.hasLimit()) return parts.sql();
      return "SELECT * FROM (" + parts.sql() + ") WHERE ROWNUM <= " + page.limit();
    }
    StringBuilder sb = new StringBuilder("SELECT * FROM (SELECT activa_q.*, ROWNUM activa_rn FROM (")
        .append(parts.sql()).append(") activa_q");
    if (page.hasLimit()) sb.append(" WHERE ROWNUM <= ").append(page.offset() + page.limit());
    return sb.append(") WHERE activa_rn > ").append(page.offset()).toString();
  }

  /** JSON_VALUE requires a constant path. */
  @Override
  protected String renderJsonExtract(String document, Expression path, RenderCtx ctx, ExprRenderer r) {
    return "JSON_VALUE(" + document + ", " + inlineJsonPath(path) + ")";
  }
}
