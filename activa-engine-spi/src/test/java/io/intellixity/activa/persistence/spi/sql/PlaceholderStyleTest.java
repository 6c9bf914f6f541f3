package io.intellixity.activa.persistence.spi.sql;

import io.intellixity.activa.persistence.compile.Bind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PlaceholderStyleTest {
  @Test
  void rendersOneMarkerPerPosition() {
    assertEquals("?", PlaceholderStyle.QUESTION_MARK.render(3));
    assertEquals("$3", PlaceholderStyle.DOLLAR_NUMBERED.render(3));
    assertEquals(":p3", PlaceholderStyle.COLON_NAMED.render(3));
    assertEquals("@p3", PlaceholderStyle.AT_NAMED.render(3));
  }

  @Test
  void statementKeepsBindsInOrder() {
    SqlStatement st = new SqlStatement("SELECT * FROM t WHERE a = $1 AND b = $2",
        List.of(Bind.of(1), Bind.of("x")));
    assertEquals(List.of(1, "x"), st.bindValues());
    assertEquals(SqlStatement.ExecKind.QUERY, st.execKind());
    assertThrows(IllegalArgumentException.class, () -> new SqlStatement(" ", List.of()));
  }
}
