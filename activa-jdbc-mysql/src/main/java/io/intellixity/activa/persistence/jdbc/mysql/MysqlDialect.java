package io.intellixity.activa.persistence.jdbc.mysql;

import io.intellixity.activa.persistence.capability.*;
import io.intellixity.activa.persistence.expr.Expression;
import io.intellixity.activa.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.activa.persistence.jdbc.dialect.ReservedWords;
import io.intellixity.activa.persistence.spi.sql.PlaceholderStyle;

import java.util.Map;
import java.util.Set;

/**
 * MySQL dialect implementation for JDBC. {@link MariaDbDialect} shares the rendering and differs in
 * its capability table.
 */
public class MysqlDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "mysql";

  private static final Set<String> RESERVED = ReservedWords.with(
      "ANALYZE", "BINARY", "BOTH", "CHANGE", "CONDITION", "CUME_DIST", "DATABASE", "DATABASES", "DENSE_RANK",
      "DIV", "DUAL", "EXPLAIN", "FIRST_VALUE", "FORCE", "FULLTEXT", "GROUPS", "IF", "IGNORE", "INDEX",
      "INTERVAL", "KEY", "KEYS", "KILL", "LAG", "LAST_VALUE", "LATERAL", "LEAD", "LIMIT", "LINES", "LOAD",
      "LOCK", "MATCH", "MOD", "NTH_VALUE", "NTILE", "OPTION", "OUTFILE", "OVER", "PARTITION", "PERCENT_RANK",
      "RANGE", "RANK", "READ", "RECURSIVE", "REGEXP", "RELEASE", "RENAME", "REPEAT", "REPLACE", "REQUIRE",
      "RLIKE", "ROW", "ROWS", "ROW_NUMBER", "SCHEMA", "SHOW", "SPATIAL", "STRAIGHT_JOIN", "SYSTEM",
      "TERMINATED", "UNLOCK", "UNSIGNED", "USAGE", "USE", "WINDOW", "WRITE", "XOR", "ZEROFILL");

  private static final Map<String, String> FUNCTIONS = Map.of(
      "NVL", "IFNULL",
      "ISNULL", "IFNULL",
      "LEN", "LENGTH",
      "GETDATE", "NOW",
      "SYSTIMESTAMP", "NOW");

  public MysqlDialect(ServerVersion version) {
    this(ID, capabilitiesFor(version));
  }

  protected MysqlDialect(String id, CapabilityDescriptor capabilities) {
    super(id, capabilities);
  }

  /** CTEs and window functions 8.0, JSON 5.7.8, INTERSECT/EXCEPT 8.0.31; no RETURNING, no FULL JOIN. */
  public static CapabilityDescriptor capabilitiesFor(ServerVersion v) {
    boolean eight = v.atLeast(8, 0);
    return CapabilityDescriptor.builder(ID, v)
        .add(SetOperationCapability.UNION, SetOperationCapability.UNION_ALL)
        .addIf(v.atLeast(8, 0, 31), SetOperationCapability.INTERSECT, SetOperationCapability.INTERSECT_ALL,
            SetOperationCapability.EXCEPT, SetOperationCapability.EXCEPT_ALL)
        .addIf(eight, CteCapability.BASIC_CTE, CteCapability.RECURSIVE_CTE)
        .addIf(eight, WindowFunctionCapability.values())
        .add(JoinCapability.INNER_JOIN, JoinCapability.LEFT_JOIN, JoinCapability.RIGHT_JOIN, JoinCapability.CROSS_JOIN)
        .addIf(v.atLeast(5, 7, 8), JsonCapability.JSON_EXTRACT)
        .add(PaginationCapability.LIMIT_OFFSET)
        .add(ExplainCapability.EXPLAIN)
        .build();
  }

  @Override public String productName() { return "MySQL"; }
  @Override public PlaceholderStyle placeholderStyle() { return PlaceholderStyle.QUESTION_MARK; }

  @Override protected String openQuote() { return "`"; }
  @Override protected String closeQuote() { return "`"; }
  @Override protected Set<String> reservedWords() { return RESERVED; }
  @Override protected Map<String, String> functionNames() { return FUNCTIONS; }

  /** 2^64-1, the documented "all rows" LIMIT. */
  @Override protected String unboundedLimit() { return "18446744073709551615"; }

  /** JSON_EXTRACT yields a JSON value; unquote it so strings compare as plain text. */
  @Override
  protected String renderJsonExtract(String document, Expression path, RenderCtx ctx, ExprRenderer r) {
    return "JSON_UNQUOTE(JSON_EXTRACT(" + document + ", " + r.render(path) + "))";
  }
}
