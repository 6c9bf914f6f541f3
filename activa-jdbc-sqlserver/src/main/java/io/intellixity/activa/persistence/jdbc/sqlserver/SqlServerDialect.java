package io.intellixity.activa.persistence.jdbc.sqlserver;

import io.intellixity.activa.persistence.capability.*;
import io.intellixity.activa.persistence.expr.Expression;
import io.intellixity.activa.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.activa.persistence.jdbc.dialect.ReservedWords;
import io.intellixity.activa.persistence.plan.OffsetPage;
import io.intellixity.activa.persistence.spi.sql.PlaceholderStyle;

import java.util.Map;
import java.util.Set;

/**
 * SQL Server dialect implementation for JDBC.
 *
 * <p>Paging: 2012+ (version 11) uses OFFSET/FETCH, which needs an ORDER BY, so {@code ORDER BY (SELECT NULL)}
 * is added when none is given. Older servers get {@code TOP n} for a plain limit and a
 * {@code ROW_NUMBER()} wrapper (extra {@code activa_rn} column) when there is an offset.</p>
 */
public final class SqlServerDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "sqlserver";

  private static final Set<String> RESERVED = ReservedWords.with(
      "ADD", "BACKUP", "BEGIN", "BREAK", "BROWSE", "BULK", "CHECKPOINT", "CLOSE", "CLUSTERED", "COMMIT",
      "COMPUTE", "CONTAINS", "CONTINUE", "CONVERT", "CURSOR", "DATABASE", "DBCC", "DEALLOCATE", "DECLARE",
      "DENY", "DISK", "DISTRIBUTED", "DUMP", "ERRLVL", "ESCAPE", "EXEC", "EXECUTE", "EXIT", "FILE",
      "FILLFACTOR", "FREETEXT", "FUNCTION", "GOTO", "HOLDLOCK", "IDENTITY", "IF", "INDEX", "KEY", "KILL",
      "LINENO", "LOAD", "MERGE", "NOCHECK", "NONCLUSTERED", "OFF", "OFFSETS", "OPEN", "OPTION", "OVER",
      "PERCENT", "PIVOT", "PLAN", "PRINT", "PROC", "PROCEDURE", "PUBLIC", "RAISERROR", "READ", "RESTORE",
      "RETURN", "REVERT", "REVOKE", "ROLLBACK", "ROWCOUNT", "RULE", "SAVE", "SCHEMA", "SHUTDOWN",
      "STATISTICS", "TOP", "TRAN", "TRANSACTION", "TRIGGER", "TRUNCATE", "TSEQUAL", "UNPIVOT", "USE",
      "VIEW", "WAITFOR", "WHILE", "WRITETEXT");

  private static final Map<String, String> FUNCTIONS = Map.of(
      "IFNULL", "ISNULL",
      "NVL", "ISNULL",
      "LENGTH", "LEN",
      "SUBSTR", "SUBSTRING",
      "NOW", "GETDATE",
      "SYSTIMESTAMP", "GETDATE");

  private final boolean offsetFetch;

  public SqlServerDialect(ServerVersion version) {
    super(ID, capabilitiesFor(version));
    this.offsetFetch = capabilities().supports(PaginationCapability.OFFSET_FETCH);
  }

  /**
   * Ranking functions and recursive CTEs from 2005 (9); offset functions, frames and OFFSET/FETCH
   * from 2012 (11); JSON_VALUE from 2016 (13). No RETURNING (OUTPUT is a different shape), no
   * INTERSECT/EXCEPT ALL, no EXPLAIN statement.
   */
  public static CapabilityDescriptor capabilitiesFor(ServerVersion v) {
    boolean v2012 = v.atLeast(11, 0);
    return CapabilityDescriptor.builder(ID, v)
        .add(SetOperationCapability.UNION, SetOperationCapability.UNION_ALL,
            SetOperationCapability.INTERSECT, SetOperationCapability.EXCEPT)
        .add(CteCapability.BASIC_CTE, CteCapability.RECURSIVE_CTE)
        .add(WindowFunctionCapability.ROW_NUMBER, WindowFunctionCapability.RANK, WindowFunctionCapability.DENSE_RANK,
            WindowFunctionCapability.NTILE, WindowFunctionCapability.AGGREGATE_OVER)
        .addIf(v2012, WindowFunctionCapability.LAG, WindowFunctionCapability.LEAD,
            WindowFunctionCapability.FIRST_VALUE, WindowFunctionCapability.LAST_VALUE,
            WindowFunctionCapability.PERCENT_RANK, WindowFunctionCapability.CUME_DIST,
            WindowFunctionCapability.WINDOW_FRAME)
        .add(JoinCapability.values())
        .addIf(v.atLeast(13, 0), JsonCapability.JSON_EXTRACT)
        .addIf(v2012, PaginationCapability.OFFSET_FETCH)
        .build();
  }

  @Override public String productName() { return "Microsoft SQL Server"; }
  @Override public PlaceholderStyle placeholderStyle() { return PlaceholderStyle.AT_NAMED; }

  @Override protected String openQuote() { return "["; }
  @Override protected String closeQuote() { return "]"; }
  @Override protected Set<String> reservedWords() { return RESERVED; }
  @Override protected Map<String, String> functionNames() { return FUNCTIONS; }
  @Override protected String recursiveKeyword() { return ""; }

  /** The pre-2012 offset wrapper puts the ORDER BY inside {@code ROW_NUMBER() OVER (...)}, before the select list. */
  @Override
  protected boolean ordersBeforeBody(OffsetPage page) {
    return !offsetFetch && page.hasOffset();
  }

  @Override
  protected String applyPage(SelectParts parts, OffsetPage page, RenderCtx ctx) {
    if (offsetFetch) {
      SelectParts p = parts;
      if (p.orderBy().isEmpty()) {
        // ORDER BY (SELECT NULL) is rejected directly on a UNION; order the derived table instead
        if (!p.isSimpleSelect()) p = p.asDerived(ctx.nextDerivedAlias("activa_page"));
        p = new SelectParts(p.select(), p.body(), "ORDER BY (SELECT NULL)");
      }
      return applyOffsetFetch(p, page);
    }

    SelectParts p = parts.isSimpleSelect() ? parts : parts.asDerived(ctx.nextDerivedAlias("activa_page"));
    if (!page.hasOffset()) {
      if (!page.hasLimit()) return p.sql();
      SelectParts top = new SelectParts(p.select() + " TOP " + page.limit(), p.body(), p.orderBy());
      return top.sql();
    }
    String order = p.orderBy().isEmpty() ? "ORDER BY (SELECT NULL)" : p.orderBy();
    String inner = p.select() + " ROW_NUMBER() OVER (" + order + ") AS activa_rn, " + p.body();
    StringBuilder sb = new StringBuilder("SELECT * FROM (").append(inner).append(") ")
        .append(ctx.nextDerivedAlias("activa_page"))
        .append(" WHERE activa_rn > ").append(page.offset());
    if (page.hasLimit()) sb.append(" AND activa_rn <= ").append(page.offset() + page.limit());
    return sb.append(" ORDER BY activa_rn").toString();
  }

  /** Constant path; SQL Server 2016 does not accept a variable there. */
  @Override
  protected String renderJsonExtract(String document, Expression path, RenderCtx ctx, ExprRenderer r) {
    return "JSON_VALUE(" + document + ", " + inlineJsonPath(path) + ")";
  }
}
