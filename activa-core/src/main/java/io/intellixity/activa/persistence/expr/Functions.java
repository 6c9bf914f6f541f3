package io.intellixity.activa.persistence.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Canonical function constructors. Names used here are the logical vocabulary dialects translate
 * from (for example {@code IFNULL} becomes {@code NVL} on Oracle).
 */
public final class Functions {
  private Functions() {}

  /** Ranking and offset functions that are only valid with an OVER clause. */
  public static final Set<String> WINDOW_ONLY = Set.of(
      "ROW_NUMBER", "RANK", "DENSE_RANK", "PERCENT_RANK", "CUME_DIST", "NTILE",
      "LAG", "LEAD", "FIRST_VALUE", "LAST_VALUE", "NTH_VALUE");

  public static final Set<String> AGGREGATES = Set.of("COUNT", "SUM", "AVG", "MIN", "MAX");

  public static final Set<String> JSON = Set.of("JSON_EXTRACT");

  public static FunctionCall func(String name, Object... args) {
    return new FunctionCall(name, wrap(args), false, null);
  }

  public static FunctionCall count() { return new FunctionCall("COUNT", List.of(new Star(null)), false, null); }
  public static FunctionCall count(Expression e) { return new FunctionCall("COUNT", List.of(e), false, null); }
  public static FunctionCall countDistinct(Expression e) { return new FunctionCall("COUNT", List.of(e), true, null); }
  public static FunctionCall sum(Expression e) { return new FunctionCall("SUM", List.of(e), false, null); }
  public static FunctionCall avg(Expression e) { return new FunctionCall("AVG", List.of(e), false, null); }
  public static FunctionCall min(Expression e) { return new FunctionCall("MIN", List.of(e), false, null); }
  public static FunctionCall max(Expression e) { return new FunctionCall("MAX", List.of(e), false, null); }

  public static FunctionCall coalesce(Object... args) { return func("COALESCE", args); }
  public static FunctionCall ifNull(Object value, Object fallback) { return func("IFNULL", value, fallback); }
  public static FunctionCall nvl(Object value, Object fallback) { return func("NVL", value, fallback); }
  public static FunctionCall lower(Expression e) { return func("LOWER", e); }
  public static FunctionCall upper(Expression e) { return func("UPPER", e); }
  public static FunctionCall length(Expression e) { return func("LENGTH", e); }
  public static FunctionCall substr(Expression e, int start, int length) { return func("SUBSTR", e, start, length); }
  public static FunctionCall now() { return func("NOW"); }

  /** Scalar extraction from a JSON document, {@code path} in {@code $.a.b} form. */
  public static FunctionCall jsonExtract(Expression document, String path) {
    return func("JSON_EXTRACT", document, path);
  }

  public static FunctionCall rowNumber() { return func("ROW_NUMBER"); }
  public static FunctionCall rank() { return func("RANK"); }
  public static FunctionCall denseRank() { return func("DENSE_RANK"); }
  public static FunctionCall ntile(int buckets) { return func("NTILE", buckets); }
  public static FunctionCall lag(Expression e, int offset) { return func("LAG", e, offset); }
  public static FunctionCall lead(Expression e, int offset) { return func("LEAD", e, offset); }
  public static FunctionCall firstValue(Expression e) { return func("FIRST_VALUE", e); }
  public static FunctionCall lastValue(Expression e) { return func("LAST_VALUE", e); }

  private static List<Expression> wrap(Object[] args) {
    if (args == null) return List.of();
    List<Expression> out = new ArrayList<>(args.length);
    for (Object a : Arrays.asList(args)) out.add(Expressions.wrap(a));
    return out;
  }
}
