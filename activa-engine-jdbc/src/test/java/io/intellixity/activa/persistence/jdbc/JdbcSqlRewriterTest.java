package io.intellixity.activa.persistence.jdbc;

import io.intellixity.activa.persistence.spi.sql.PlaceholderStyle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcSqlRewriterTest {
  @Test
  void rewritesDollarMarkersOutsideQuotesAndCasts() {
    assertEquals("SELECT * FROM t WHERE a = ? AND b = '$2' AND c::text = ?",
        JdbcSqlRewriter.toJdbcSql("SELECT * FROM t WHERE a = $1 AND b = '$2' AND c::text = $2",
            PlaceholderStyle.DOLLAR_NUMBERED));
  }

  @Test
  void leavesIdentifiersThatLookLikeMarkers() {
    assertEquals("a = ? AND b = :p1x AND \":p2\" = ?",
        JdbcSqlRewriter.toJdbcSql("a = :p1 AND b = :p1x AND \":p2\" = :p3", PlaceholderStyle.COLON_NAMED));
    assertEquals("[@p1] = ?", JdbcSqlRewriter.toJdbcSql("[@p1] = @p2", PlaceholderStyle.AT_NAMED));
    assertEquals("a = ?", JdbcSqlRewriter.toJdbcSql("a = ?", PlaceholderStyle.QUESTION_MARK));
  }

  @Test
  void expandsQuestionMarksSkippingEscapedQuotes() {
    int[] count = new int[1];
    String sql = JdbcSqlRewriter.expandQuestionMarks("x = 'it''s ?' AND y = ? AND z = ?", k -> "$" + (k + 1), count);
    assertEquals("x = 'it''s ?' AND y = $1 AND z = $2", sql);
    assertEquals(2, count[0]);
  }
}
