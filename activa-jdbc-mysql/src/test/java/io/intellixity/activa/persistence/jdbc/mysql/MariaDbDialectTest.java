package io.intellixity.activa.persistence.jdbc.mysql;

import io.intellixity.activa.persistence.capability.ReturningCapability;
import io.intellixity.activa.persistence.capability.ServerVersion;
import io.intellixity.activa.persistence.capability.SetOperationCapability;
import io.intellixity.activa.persistence.capability.UnsupportedFeatureException;
import io.intellixity.activa.persistence.plan.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.activa.persistence.expr.Expressions.col;
import static org.junit.jupiter.api.Assertions.*;

final class MariaDbDialectTest {
  @Test
  void returningDependsOnStatementAndVersion() {
    MariaDbDialect v104 = new MariaDbDialect(ServerVersion.parse("10.4.32-MariaDB"));
    MariaDbDialect v106 = new MariaDbDialect(ServerVersion.parse("10.6.12-MariaDB-1:10.6.12+maria~ubu2004"));
    InsertPlan ins = new InsertPlan("users", List.of(ColumnValue.of("name", "ann")), List.of("id"));
    DeletePlan del = new DeletePlan("users", col("id").eq(1), List.of("id"));
    UpdatePlan upd = new UpdatePlan("users", List.of(ColumnValue.of("name", "bob")), null, List.of("id"));

    assertThrows(UnsupportedFeatureException.class, () -> v104.compileDml(ins));
    assertEquals("DELETE FROM users WHERE id = ? RETURNING id", v104.compileDml(del).sql());
    assertEquals("INSERT INTO users (name) VALUES (?) RETURNING id", v106.compileDml(ins).sql());
    assertThrows(UnsupportedFeatureException.class, () -> v106.compileDml(upd));
  }

  @Test
  void keepsItsOwnIdentity() {
    MariaDbDialect d = new MariaDbDialect(ServerVersion.of(10, 3));
    assertEquals("mariadb", d.id());
    assertEquals("MariaDB", d.productName());
    assertTrue(d.capabilities().supports(SetOperationCapability.EXCEPT));
    assertFalse(d.capabilities().supports(SetOperationCapability.EXCEPT_ALL));
    assertFalse(d.capabilities().supports(ReturningCapability.RETURNING_UPDATE));
    assertEquals("`select`", d.quoteIdentifier("select"));
  }

  @Test
  void recursiveCtesFrom1022() {
    assertThrows(UnsupportedFeatureException.class,
        () -> new MariaDbDialect(ServerVersion.of(10, 2, 1)).compile(MysqlDialectTest.treeQuery()));
    assertTrue(new MariaDbDialect(ServerVersion.of(10, 2, 2)).compile(MysqlDialectTest.treeQuery()).sql()
        .startsWith("WITH RECURSIVE tree AS ("));
  }
}
