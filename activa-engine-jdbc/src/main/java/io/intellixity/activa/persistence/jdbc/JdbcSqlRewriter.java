package io.intellixity.activa.persistence.jdbc;

import io.intellixity.activa.persistence.spi.sql.PlaceholderStyle;

import java.util.function.IntFunction;

/**
 * Lexical placeholder rewriting.
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>text inside single quotes, double quotes, backticks and brackets is copied verbatim</li>
 *   <li>{@code ''} inside a string is an escaped quote</li>
 *   <li>{@code ::} is a cast, never a parameter</li>
 * </ul>
 */
public final class JdbcSqlRewriter {
  private JdbcSqlRewriter() {}

  /**
   * Rewrites dialect placeholders ({@code $n}, {@code :pN}, {@code @pN}) to JDBC {@code ?}. Statements
   * always number their placeholders in bind order, so positions are preserved.
   */
  public static String toJdbcSql(String sql, PlaceholderStyle style) {
    if (sql == null) return "";
    if (style == PlaceholderStyle.QUESTION_MARK) return sql;
    StringBuilder out = new StringBuilder(sql.length());
    int i = 0;
    while (i < sql.length()) {
      int skip = quotedEnd(sql, i);
      if (skip > i) {
        out.append(sql, i, skip);
        i = skip;
        continue;
      }
      char ch = sql.charAt(i);
      if (ch == ':' && i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
        out.append("::");
        i += 2;
        continue;
      }
      int end = placeholderEnd(sql, i, style);
      if (end > i) {
        out.append('?');
        i = end;
        continue;
      }
      out.append(ch);
      i++;
    }
    return out.toString();
  }

  /**
   * Replaces every positional {@code ?} marker outside quoted text with {@code placeholder.apply(k)},
   * k counting from 0. Returns the rewritten SQL; {@code counter[0]} receives the marker count.
   */
  public static String expandQuestionMarks(String sql, IntFunction<String> placeholder, int[] counter) {
    StringBuilder out = new StringBuilder(sql.length() + 16);
    int n = 0;
    int i = 0;
    while (i < sql.length()) {
      int skip = quotedEnd(sql, i);
      if (skip > i) {
        out.append(sql, i, skip);
        i = skip;
        continue;
      }
      char ch = sql.charAt(i);
      if (ch == '?') {
        out.append(placeholder.apply(n++));
      } else {
        out.append(ch);
      }
      i++;
    }
    counter[0] = n;
    return out.toString();
  }

  private static int placeholderEnd(String sql, int i, PlaceholderStyle style) {
    char ch = sql.charAt(i);
    int start;
    switch (style) {
      case DOLLAR_NUMBERED -> {
        if (ch != '$') return i;
        start = i + 1;
      }
      case COLON_NAMED -> {
        if (ch != ':' || i + 1 >= sql.length() || sql.charAt(i + 1) != 'p') return i;
        start = i + 2;
      }
      case AT_NAMED -> {
        if (ch != '@' || i + 1 >= sql.length() || sql.charAt(i + 1) != 'p') return i;
        start = i + 2;
      }
      default -> {
        return i;
      }
    }
    int end = start;
    while (end < sql.length() && Character.isDigit(sql.charAt(end))) end++;
    if (end == start) return i;
    // ":p1x" is an identifier, not a marker
    if (end < sql.length() && (Character.isLetterOrDigit(sql.charAt(end)) || sql.charAt(end) == '_')) return i;
    return end;
  }

  /** If a quoted section starts at {@code i}, the index just past it; otherwise {@code i}. */
  private static int quotedEnd(String sql, int i) {
    char open = sql.charAt(i);
    char close;
    switch (open) {
      case '\'', '"', '`' -> close = open;
      case '[' -> close = ']';
      default -> {
        return i;
      }
    }
    int j = i + 1;
    while (j < sql.length()) {
      if (sql.charAt(j) == close) {
        if (j + 1 < sql.length() && sql.charAt(j + 1) == close) {
          j += 2;
          continue;
        }
        return j + 1;
      }
      j++;
    }
    return sql.length();
  }
}
