package io.intellixity.activa.persistence.jdbc.dialect;

import io.intellixity.activa.persistence.capability.CapabilityDescriptor;
import io.intellixity.activa.persistence.capability.CteCapability;
import io.intellixity.activa.persistence.capability.ExplainCapability;
import io.intellixity.activa.persistence.capability.JoinCapability;
import io.intellixity.activa.persistence.capability.JsonCapability;
import io.intellixity.activa.persistence.capability.ReturningCapability;
import io.intellixity.activa.persistence.capability.SetOperationCapability;
import io.intellixity.activa.persistence.capability.WindowFunctionCapability;
import io.intellixity.activa.persistence.compile.Bind;
import io.intellixity.activa.persistence.compile.PlanValidator;
import io.intellixity.activa.persistence.expr.*;
import io.intellixity.activa.persistence.jdbc.JdbcSqlRewriter;
import io.intellixity.activa.persistence.plan.*;
import io.intellixity.activa.persistence.spi.sql.PlaceholderStyle;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;
import io.intellixity.activa.persistence.spi.sql.SqlStatement.ExecKind;

import java.util.*;
import java.util.regex.Pattern;

/**
 * JDBC-generic SQL compiler.
 *
 * <p>Provides common rendering for:</p>
 * <ul>
 *   <li>SELECT plans: CTEs, projection, joins, filters, grouping, ordering, paging</li>
 *   <li>set operations, nested through derived tables where needed</li>
 *   <li>DML: insert/update/delete with optional RETURNING</li>
 * </ul>
 *
 * <p>Vendor dialects override hooks for quoting, paging, function names, set-operation keywords and
 * EXPLAIN. Every feature is checked against the {@link CapabilityDescriptor} before any text is
 * produced for it, so unsupported plans fail at compile time.</p>
 *
 * <p>Literals are always bound; placeholders are numbered in textual order and never reused.</p>
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  private static final Pattern SIMPLE_IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Set<String> NILADIC = Set.of("CURRENT_TIMESTAMP", "CURRENT_DATE", "SYSTIMESTAMP", "SYSDATE");
  private static final Pattern JSON_PATH = Pattern.compile("\\$(\\.[A-Za-z_][A-Za-z0-9_]*|\\[\\d+])*");
  private static final int ATOMIC = 100;

  protected static final class RenderCtx {
    private final PlaceholderStyle style;
    private final List<Bind> binds = new ArrayList<>();
    private int n = 1;
    private int derived = 0;

    RenderCtx(PlaceholderStyle style) {
      this.style = style;
    }

    public String add(Bind b) {
      binds.add(b);
      return style.render(n++);
    }

    /** Fresh alias for a derived table introduced by the compiler itself. */
    public String nextDerivedAlias(String prefix) {
      return prefix + "_" + (++derived);
    }

    public List<Bind> binds() { return binds; }
  }

  /**
   * A rendered SELECT split where paging needs to hook in. {@code select} is null when the body is a
   * set operation rather than a single SELECT.
   */
  protected record SelectParts(String select, String body, String orderBy) {
    public SelectParts {
      Objects.requireNonNull(body, "body");
      orderBy = orderBy == null ? "" : orderBy;
    }

    public boolean isSimpleSelect() { return select != null; }

    public String withoutOrder() {
      return select == null ? body : select + " " + body;
    }

    public String sql() {
      String base = withoutOrder();
      return orderBy.isEmpty() ? base : base + " " + orderBy;
    }

    /** {@code SELECT * FROM (body) alias ORDER BY ...}; ordering stays outside. */
    public SelectParts asDerived(String alias) {
      return new SelectParts("SELECT", "* FROM (" + withoutOrder() + ") " + alias, orderBy);
    }
  }

  private final String id;
  private final CapabilityDescriptor capabilities;

  protected AbstractJdbcSqlDialect(String id, CapabilityDescriptor capabilities) {
    this.id = Objects.requireNonNull(id, "id");
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
  }

  @Override public String id() { return id; }
  @Override public CapabilityDescriptor capabilities() { return capabilities; }

  // ---------------------------------------------------------------------------------------------
  // entry points
  // ---------------------------------------------------------------------------------------------

  @Override
  public final SqlStatement compile(Queryable query) {
    RenderCtx ctx = new RenderCtx(placeholderStyle());
    String sql = renderQueryable(query, ctx);
    return new SqlStatement(sql, ctx.binds(), ExecKind.QUERY);
  }

  @Override
  public final SqlStatement compileExplain(Queryable query) {
    capabilities.require(ExplainCapability.EXPLAIN, "EXPLAIN");
    SqlStatement inner = compile(query);
    return new SqlStatement(explainPrefix() + " " + inner.sql(), inner.binds(), ExecKind.QUERY);
  }

  @Override
  public final SqlStatement compileDml(DmlPlan plan) {
    if (plan instanceof InsertPlan ins) return renderInsert(ins);
    if (plan instanceof UpdatePlan upd) return renderUpdate(upd);
    if (plan instanceof DeletePlan del) return renderDelete(del);
    throw new IllegalArgumentException("Unknown DmlPlan: " + plan);
  }

  // ---------------------------------------------------------------------------------------------
  // hooks
  // ---------------------------------------------------------------------------------------------

  protected abstract String openQuote();

  protected abstract String closeQuote();

  protected Set<String> reservedWords() {
    return ReservedWords.COMMON;
  }

  protected boolean needsQuoting(String identifier) {
    return !SIMPLE_IDENT.matcher(identifier).matches()
        || reservedWords().contains(identifier.toUpperCase(Locale.ROOT));
  }

  /** Canonical function name to native name. Unknown names pass through. */
  protected Map<String, String> functionNames() {
    return Map.of();
  }

  /** Keyword after WITH for recursive CTEs; empty on backends that infer recursion. */
  protected String recursiveKeyword() {
    return "RECURSIVE";
  }

  protected String setOperatorKeyword(SetOperator op) {
    return op.name();
  }

  protected String explainPrefix() {
    return "EXPLAIN";
  }

  /** LIMIT value meaning "all rows", for offset-only pages; null when OFFSET may stand alone. */
  protected String unboundedLimit() {
    return null;
  }

  /** Default: {@code LIMIT n OFFSET m}. Values are inlined (always non-negative longs). */
  protected String applyPage(SelectParts parts, OffsetPage page, RenderCtx ctx) {
    StringBuilder sb = new StringBuilder(parts.sql());
    if (page.hasLimit()) {
      sb.append(" LIMIT ").append(page.limit());
    } else if (page.hasOffset() && unboundedLimit() != null) {
      sb.append(" LIMIT ").append(unboundedLimit());
    }
    if (page.hasOffset()) sb.append(" OFFSET ").append(page.offset());
    return sb.toString();
  }

  /**
   * True when {@link #applyPage} writes the ORDER BY text ahead of the select list for this page.
   * The ORDER BY is then rendered first, so its placeholders are numbered in text order.
   */
  protected boolean ordersBeforeBody(OffsetPage page) {
    return false;
  }

  /** {@code OFFSET m ROWS FETCH NEXT n ROWS ONLY}, shared by Oracle 12c+ and SQL Server 2012+. */
  protected final String applyOffsetFetch(SelectParts parts, OffsetPage page) {
    StringBuilder sb = new StringBuilder(parts.sql());
    sb.append(" OFFSET ").append(page.offset()).append(" ROWS");
    if (page.hasLimit()) sb.append(" FETCH NEXT ").append(page.limit()).append(" ROWS ONLY");
    return sb.toString();
  }

  /** JSON scalar extraction; default is {@code JSON_EXTRACT(doc, path)}. */
  protected String renderJsonExtract(String document, Expression path, RenderCtx ctx, ExprRenderer r) {
    return "JSON_EXTRACT(" + document + ", " + r.render(path) + ")";
  }

  /**
   * JSON path as an inline string literal, for backends that require a constant path. Only simple
   * {@code $.key[0].key} paths are accepted, so the literal never needs escaping.
   */
  protected static String inlineJsonPath(Expression path) {
    if (path instanceof Literal l && l.value() instanceof String s && JSON_PATH.matcher(s).matches()) {
      return "'" + s + "'";
    }
    throw new InvalidPlanException("JSON path must be a literal of the form $.key[0].key, got " + path);
  }

  /** Splits {@code $.a[0].b} into {@code [a, 0, b]}. */
  protected static List<String> jsonPathSegments(Expression path) {
    String literal = inlineJsonPath(path);
    String p = literal.substring(2, literal.length() - 1);
    List<String> out = new ArrayList<>();
    for (String part : p.replace("[", ".").replace("]", "").split("\\.")) {
      if (!part.isEmpty()) out.add(part);
    }
    return out;
  }

  /** Trailing RETURNING clause; only reached once the capability has been checked. */
  protected String renderReturning(List<String> columns) {
    return " RETURNING " + joinIdents(columns);
  }

  // ---------------------------------------------------------------------------------------------
  // quoting
  // ---------------------------------------------------------------------------------------------

  @Override
  public String quoteIdentifier(String identifier) {
    Objects.requireNonNull(identifier, "identifier");
    if ("*".equals(identifier)) return identifier;
    if (!needsQuoting(identifier)) return identifier;
    String close = closeQuote();
    return openQuote() + identifier.replace(close, close + close) + closeQuote();
  }

  /** Dotted names ({@code schema.table}) are quoted part by part. */
  protected String quoteQualified(String name) {
    if (name.indexOf('.') < 0) return quoteIdentifier(name);
    StringJoiner j = new StringJoiner(".");
    for (String part : name.split("\\.")) j.add(quoteIdentifier(part));
    return j.toString();
  }

  protected String joinIdents(List<String> idents) {
    StringJoiner j = new StringJoiner(", ");
    for (String i : idents) j.add(quoteIdentifier(i));
    return j.toString();
  }

  // ---------------------------------------------------------------------------------------------
  // queries
  // ---------------------------------------------------------------------------------------------

  protected String renderQueryable(Queryable q, RenderCtx ctx) {
    PlanValidator.validate(q);
    if (q instanceof QueryPlan p) return renderSelect(p, ctx);
    if (q instanceof SetOperation s) return renderSetOperation(s, ctx);
    throw new IllegalArgumentException("Unknown Queryable: " + q);
  }

  protected String renderSelect(QueryPlan p, RenderCtx ctx) {
    String with = p.ctes().isEmpty() ? "" : renderWith(p, ctx) + " ";
    SelectParts parts = renderSelectParts(p, ctx);
    String body = p.page() == null ? parts.sql() : applyPage(parts, p.page(), ctx);
    return with + body;
  }

  protected String renderWith(QueryPlan p, RenderCtx ctx) {
    capabilities.require(CteCapability.BASIC_CTE, "WITH clause");
    if (p.recursive()) capabilities.require(CteCapability.RECURSIVE_CTE, "recursive CTE");
    StringBuilder sb = new StringBuilder("WITH ");
    if (p.recursive() && !recursiveKeyword().isEmpty()) sb.append(recursiveKeyword()).append(' ');
    boolean first = true;
    for (CommonTableExpression cte : p.ctes()) {
      if (!first) sb.append(", ");
      first = false;
      sb.append(quoteIdentifier(cte.name()));
      if (!cte.columns().isEmpty()) sb.append(" (").append(joinIdents(cte.columns())).append(')');
      sb.append(" AS ");
      switch (cte.materialization()) {
        case MATERIALIZED -> {
          capabilities.require(CteCapability.MATERIALIZED_CTE, "MATERIALIZED CTE hint");
          sb.append("MATERIALIZED ");
        }
        case NOT_MATERIALIZED -> {
          capabilities.require(CteCapability.MATERIALIZED_CTE, "NOT MATERIALIZED CTE hint");
          sb.append("NOT MATERIALIZED ");
        }
        case DEFAULT -> { }
      }
      sb.append('(').append(renderCteBody(cte.query(), ctx)).append(')');
    }
    return sb.toString();
  }

  /** CTE bodies are validated with the enclosing plan; a body that itself has CTEs is rendered as-is. */
  private String renderCteBody(Queryable q, RenderCtx ctx) {
    if (q instanceof QueryPlan p) return renderSelect(p, ctx);
    if (q instanceof SetOperation s) return renderSetOperation(s, ctx);
    throw new IllegalArgumentException("Unknown Queryable: " + q);
  }

  protected SelectParts renderSelectParts(QueryPlan p, RenderCtx ctx) {
    ExprRenderer r = new ExprRenderer(ctx);
    String select = p.distinct() ? "SELECT DISTINCT" : "SELECT";
    String leadingOrder = p.page() != null && ordersBeforeBody(p.page()) ? renderOrderBy(p.orderBy(), r) : null;

    StringBuilder body = new StringBuilder();
    if (p.select().isEmpty()) {
      body.append('*');
    } else {
      StringJoiner items = new StringJoiner(", ");
      for (Expression e : p.select()) items.add(r.render(e));
      body.append(items);
    }
    body.append(" FROM ").append(renderSource(p.from(), ctx));
    for (JoinClause j : p.joins()) {
      requireJoin(j.kind());
      body.append(' ').append(j.kind().keyword()).append(' ').append(renderSource(j.target(), ctx));
      if (j.on() != null) body.append(" ON ").append(r.render(j.on()));
    }
    if (p.where() != null) body.append(" WHERE ").append(r.render(p.where()));
    if (!p.groupBy().isEmpty()) {
      StringJoiner g = new StringJoiner(", ");
      for (Expression e : p.groupBy()) g.add(r.render(e));
      body.append(" GROUP BY ").append(g);
    }
    if (p.having() != null) body.append(" HAVING ").append(r.render(p.having()));

    String order = leadingOrder != null ? leadingOrder : renderOrderBy(p.orderBy(), r);
    return new SelectParts(select, body.toString(), order);
  }

  protected String renderOrderBy(List<OrderItem> items, ExprRenderer r) {
    if (items.isEmpty()) return "";
    StringJoiner j = new StringJoiner(", ");
    for (OrderItem o : items) j.add(r.render(o.expression()) + " " + o.direction().name());
    return "ORDER BY " + j;
  }

  protected String renderSource(Source s, RenderCtx ctx) {
    if (s instanceof TableSource t) {
      String out = quoteQualified(t.name());
      return t.alias() == null ? out : out + " " + quoteIdentifier(t.alias());
    }
    if (s instanceof SubquerySource sq) {
      return "(" + renderQueryable(sq.query(), ctx) + ") " + quoteIdentifier(sq.alias());
    }
    throw new IllegalArgumentException("Unknown Source: " + s);
  }

  private void requireJoin(JoinKind kind) {
    switch (kind) {
      case INNER -> capabilities.require(JoinCapability.INNER_JOIN, "INNER JOIN");
      case LEFT -> capabilities.require(JoinCapability.LEFT_JOIN, "LEFT JOIN");
      case RIGHT -> capabilities.require(JoinCapability.RIGHT_JOIN, "RIGHT JOIN",
          "swap the operands and use a LEFT JOIN");
      case FULL -> capabilities.require(JoinCapability.FULL_JOIN, "FULL OUTER JOIN",
          "combine a LEFT JOIN and an anti-joined RIGHT side with UNION ALL");
      case CROSS -> capabilities.require(JoinCapability.CROSS_JOIN, "CROSS JOIN");
    }
  }

  // ---------------------------------------------------------------------------------------------
  // set operations
  // ---------------------------------------------------------------------------------------------

  protected String renderSetOperation(SetOperation s, RenderCtx ctx) {
    requireSetOperation(s.operator(), s.all());
    ExprRenderer r = new ExprRenderer(ctx);
    String leadingOrder = s.page() != null && ordersBeforeBody(s.page()) ? renderOrderBy(s.orderBy(), r) : null;
    String left = renderSetOperand(s.left(), s, true, ctx);
    String right = renderSetOperand(s.right(), s, false, ctx);
    String body = left + " " + setOperatorKeyword(s.operator()) + (s.all() ? " ALL " : " ") + right;
    String order = leadingOrder != null ? leadingOrder : renderOrderBy(s.orderBy(), r);
    SelectParts parts = new SelectParts(null, body, order);
    return s.page() == null ? parts.sql() : applyPage(parts, s.page(), ctx);
  }

  /**
   * A left-nested operand with the same operator and ALL flag is flattened (the chain is associative);
   * any other nested set operation, or a plan carrying its own WITH clause, becomes a derived table so
   * backend precedence rules between UNION, INTERSECT and EXCEPT never matter.
   */
  private String renderSetOperand(Queryable q, SetOperation parent, boolean leftSide, RenderCtx ctx) {
    if (q instanceof SetOperation nested) {
      if (leftSide && nested.operator() == parent.operator() && nested.all() == parent.all()) {
        return renderSetOperation(nested, ctx);
      }
      return "SELECT * FROM (" + renderSetOperation(nested, ctx) + ") " + ctx.nextDerivedAlias("activa_set");
    }
    QueryPlan p = (QueryPlan) q;
    if (!p.ctes().isEmpty()) {
      return "SELECT * FROM (" + renderSelect(p, ctx) + ") " + ctx.nextDerivedAlias("activa_set");
    }
    return renderSelect(p, ctx);
  }

  private void requireSetOperation(SetOperator op, boolean all) {
    SetOperationCapability cap = switch (op) {
      case UNION -> all ? SetOperationCapability.UNION_ALL : SetOperationCapability.UNION;
      case INTERSECT -> all ? SetOperationCapability.INTERSECT_ALL : SetOperationCapability.INTERSECT;
      case EXCEPT -> all ? SetOperationCapability.EXCEPT_ALL : SetOperationCapability.EXCEPT;
    };
    String feature = op.name() + (all ? " ALL" : "");
    String suggestion = switch (op) {
      case UNION -> null;
      case INTERSECT -> all ? "use INTERSECT without ALL" : "rewrite as EXISTS or an INNER JOIN";
      case EXCEPT -> all ? "use EXCEPT without ALL" : "rewrite as NOT EXISTS or a LEFT JOIN anti-join";
    };
    capabilities.require(cap, feature, suggestion);
  }

  // ---------------------------------------------------------------------------------------------
  // DML
  // ---------------------------------------------------------------------------------------------

  protected SqlStatement renderInsert(InsertPlan ins) {
    if (ins.values().isEmpty()) throw new IllegalArgumentException("Insert requires at least one column");
    RenderCtx ctx = new RenderCtx(placeholderStyle());
    ExprRenderer r = new ExprRenderer(ctx);
    StringJoiner cols = new StringJoiner(", ");
    StringJoiner vals = new StringJoiner(", ");
    for (ColumnValue cv : ins.values()) {
      cols.add(quoteIdentifier(cv.column()));
      vals.add(r.render(cv.value()));
    }
    String sql = "INSERT INTO " + quoteQualified(ins.table()) + " (" + cols + ") VALUES (" + vals + ")";
    if (!ins.returning().isEmpty()) {
      capabilities.require(ReturningCapability.RETURNING_INSERT, "INSERT ... RETURNING",
          "re-select the row by its key after the insert");
      return new SqlStatement(sql + renderReturning(ins.returning()), ctx.binds(), ExecKind.QUERY);
    }
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  protected SqlStatement renderUpdate(UpdatePlan upd) {
    if (upd.sets().isEmpty()) throw new IllegalArgumentException("Update requires at least one column");
    RenderCtx ctx = new RenderCtx(placeholderStyle());
    ExprRenderer r = new ExprRenderer(ctx);
    StringJoiner sets = new StringJoiner(", ");
    for (ColumnValue cv : upd.sets()) sets.add(quoteIdentifier(cv.column()) + " = " + r.render(cv.value()));
    String sql = "UPDATE " + quoteQualified(upd.table()) + " SET " + sets;
    if (upd.where() != null) sql += " WHERE " + r.render(upd.where());
    if (!upd.returning().isEmpty()) {
      capabilities.require(ReturningCapability.RETURNING_UPDATE, "UPDATE ... RETURNING",
          "re-select the affected rows after the update");
      return new SqlStatement(sql + renderReturning(upd.returning()), ctx.binds(), ExecKind.QUERY);
    }
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  protected SqlStatement renderDelete(DeletePlan del) {
    RenderCtx ctx = new RenderCtx(placeholderStyle());
    ExprRenderer r = new ExprRenderer(ctx);
    String sql = "DELETE FROM " + quoteQualified(del.table());
    if (del.where() != null) sql += " WHERE " + r.render(del.where());
    if (!del.returning().isEmpty()) {
      capabilities.require(ReturningCapability.RETURNING_DELETE, "DELETE ... RETURNING",
          "select the rows before deleting them");
      return new SqlStatement(sql + renderReturning(del.returning()), ctx.binds(), ExecKind.QUERY);
    }
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  // ---------------------------------------------------------------------------------------------
  // expressions
  // ---------------------------------------------------------------------------------------------

  /**
   * Expression renderer. Parentheses are emitted from operator precedence only: a child is wrapped
   * when it binds looser than its parent, when it is the right operand of a non-associative (or a
   * different) operator of equal precedence, and comparisons never chain unparenthesized.
   */
  protected final class ExprRenderer implements ExpressionVisitor<String> {
    private final RenderCtx ctx;

    ExprRenderer(RenderCtx ctx) {
      this.ctx = ctx;
    }

    public RenderCtx ctx() { return ctx; }

    public String render(Expression e) {
      return e.accept(this);
    }

    private String operand(Expression child, int parentPrec) {
      String s = render(child);
      return precedence(child) <= parentPrec ? "(" + s + ")" : s;
    }

    private String binaryChild(Expression child, BinaryOperator parent, boolean right) {
      String s = render(child);
      int cp = precedence(child);
      int pp = parent.precedence();
      boolean wrap;
      if (cp < pp) {
        wrap = true;
      } else if (cp > pp) {
        wrap = false;
      } else if (parent.isComparison()) {
        wrap = true;
      } else if (right) {
        wrap = !(parent.associative() && child instanceof BinaryOp b && b.operator() == parent);
      } else {
        wrap = false;
      }
      return wrap ? "(" + s + ")" : s;
    }

    @Override
    public String visitColumn(Column c) {
      String name = quoteIdentifier(c.name());
      return c.table() == null ? name : quoteIdentifier(c.table()) + "." + name;
    }

    @Override
    public String visitLiteral(Literal l) {
      if (l.isNullValue()) return "NULL";
      return ctx.add(Bind.of(l));
    }

    @Override
    public String visitBinary(BinaryOp b) {
      return binaryChild(b.left(), b.operator(), false) + " " + b.operator().symbol() + " "
          + binaryChild(b.right(), b.operator(), true);
    }

    @Override
    public String visitUnary(UnaryOp u) {
      String inner = render(u.operand());
      boolean atomic = precedence(u.operand()) == ATOMIC;
      return u.operator().prefix() + (atomic ? inner : "(" + inner + ")");
    }

    @Override
    public String visitFunction(FunctionCall f) {
      String canonical = f.canonicalName();
      if (Functions.WINDOW_ONLY.contains(canonical) && !f.isWindowed()) {
        throw new InvalidPlanException(canonical + " requires an OVER clause");
      }
      if (f.isWindowed()) {
        capabilities.require(WindowFunctionCapability.forFunction(canonical), canonical + " OVER (...)");
        if (f.over().frame() != null) capabilities.require(WindowFunctionCapability.WINDOW_FRAME, "window frame");
      }
      String call;
      if (Functions.JSON.contains(canonical)) {
        capabilities.require(JsonCapability.JSON_EXTRACT, "JSON extraction");
        if (f.args().size() != 2) throw new InvalidPlanException("JSON_EXTRACT takes a document and a path");
        call = renderJsonExtract(render(f.args().get(0)), f.args().get(1), ctx, this);
      } else {
        String mapped = functionNames().get(canonical);
        String name = mapped != null ? mapped : f.name();
        if (f.args().isEmpty() && NILADIC.contains(mapped != null ? mapped : canonical)) {
          call = mapped != null ? mapped : canonical;
        } else {
          StringJoiner args = new StringJoiner(", ");
          for (Expression a : f.args()) args.add(render(a));
          call = name + "(" + (f.distinct() ? "DISTINCT " : "") + args + ")";
        }
      }
      return f.isWindowed() ? call + " OVER (" + renderWindow(f.over()) + ")" : call;
    }

    private String renderWindow(WindowSpec w) {
      List<String> parts = new ArrayList<>();
      if (!w.partitionBy().isEmpty()) {
        StringJoiner j = new StringJoiner(", ");
        for (Expression e : w.partitionBy()) j.add(render(e));
        parts.add("PARTITION BY " + j);
      }
      String order = renderOrderBy(w.orderBy(), this);
      if (!order.isEmpty()) parts.add(order);
      if (w.frame() != null) parts.add(renderFrame(w.frame()));
      return String.join(" ", parts);
    }

    private String renderFrame(WindowFrame f) {
      if (f.end() == null) return f.unit().name() + " " + bound(f.start());
      return f.unit().name() + " BETWEEN " + bound(f.start()) + " AND " + bound(f.end());
    }

    private String bound(WindowFrame.Bound b) {
      return switch (b.kind()) {
        case UNBOUNDED_PRECEDING -> "UNBOUNDED PRECEDING";
        case PRECEDING -> b.offset() + " PRECEDING";
        case CURRENT_ROW -> "CURRENT ROW";
        case FOLLOWING -> b.offset() + " FOLLOWING";
        case UNBOUNDED_FOLLOWING -> "UNBOUNDED FOLLOWING";
      };
    }

    @Override
    public String visitSubquery(Subquery s) {
      return "(" + renderQueryable(s.query(), ctx) + ")";
    }

    @Override
    public String visitCase(CaseWhen c) {
      StringBuilder sb = new StringBuilder("CASE");
      for (CaseWhen.When w : c.branches()) {
        sb.append(" WHEN ").append(render(w.condition())).append(" THEN ").append(render(w.result()));
      }
      if (c.otherwise() != null) sb.append(" ELSE ").append(render(c.otherwise()));
      return sb.append(" END").toString();
    }

    @Override
    public String visitInList(InList in) {
      // x IN () is invalid SQL on every backend
      if (in.values().isEmpty()) return in.negated() ? "1 = 1" : "1 = 0";
      StringJoiner j = new StringJoiner(", ");
      for (Expression v : in.values()) j.add(render(v));
      return operand(in.operand(), BinaryOperator.PREDICATE_PRECEDENCE)
          + (in.negated() ? " NOT IN (" : " IN (") + j + ")";
    }

    @Override
    public String visitInSubquery(InSubquery in) {
      return operand(in.operand(), BinaryOperator.PREDICATE_PRECEDENCE)
          + (in.negated() ? " NOT IN (" : " IN (") + renderQueryable(in.query(), ctx) + ")";
    }

    @Override
    public String visitBetween(Between b) {
      return operand(b.operand(), BinaryOperator.PREDICATE_PRECEDENCE)
          + (b.negated() ? " NOT BETWEEN " : " BETWEEN ")
          + operand(b.low(), BinaryOperator.PREDICATE_PRECEDENCE)
          + " AND " + operand(b.high(), BinaryOperator.PREDICATE_PRECEDENCE);
    }

    @Override
    public String visitIsNull(IsNull n) {
      return operand(n.operand(), BinaryOperator.PREDICATE_PRECEDENCE) + (n.negated() ? " IS NOT NULL" : " IS NULL");
    }

    @Override
    public String visitExists(Exists e) {
      return (e.negated() ? "NOT EXISTS (" : "EXISTS (") + renderQueryable(e.query(), ctx) + ")";
    }

    @Override
    public String visitAliased(Aliased a) {
      return render(a.expression()) + " AS " + quoteIdentifier(a.alias());
    }

    @Override
    public String visitStar(Star s) {
      return s.table() == null ? "*" : quoteIdentifier(s.table()) + ".*";
    }

    @Override
    public String visitRaw(RawSql raw) {
      int[] count = new int[1];
      List<Object> params = raw.params();
      String sql = JdbcSqlRewriter.expandQuestionMarks(raw.sql(), k -> {
        if (k >= params.size()) {
          throw new IllegalArgumentException("Raw SQL has more '?' markers than parameters: " + raw.sql());
        }
        return ctx.add(Bind.of(params.get(k)));
      }, count);
      if (count[0] != params.size()) {
        throw new IllegalArgumentException("Raw SQL expects " + count[0] + " parameters, got " + params.size());
      }
      return sql;
    }
  }

  /** Binding strength used for parenthesization; atomic nodes never need parentheses. */
  protected static int precedence(Expression e) {
    if (e instanceof BinaryOp b) return b.operator().precedence();
    if (e instanceof UnaryOp u) return u.operator().precedence();
    if (e instanceof InList || e instanceof InSubquery || e instanceof Between || e instanceof IsNull) {
      return BinaryOperator.PREDICATE_PRECEDENCE;
    }
    if (e instanceof RawSql) return 0;
    return ATOMIC;
  }
}
