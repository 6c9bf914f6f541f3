package io.intellixity.activa.persistence.capability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ServerVersionTest {
  @Test
  void parsesVendorVersionStrings() {
    assertEquals(ServerVersion.of(8, 0, 36), ServerVersion.parse("8.0.36-0ubuntu0.22.04.1"));
    assertEquals(ServerVersion.of(16, 2), ServerVersion.parse("16.2 (Debian 16.2-1.pgdg120+2)"));
    assertEquals(ServerVersion.of(11, 2, 0), ServerVersion.parse("Oracle Database 11g Enterprise Edition Release 11.2.0.4.0 - 64bit"));
    assertEquals(ServerVersion.of(3, 45, 1), ServerVersion.parse("3.45.1"));
    assertEquals(ServerVersion.of(15, 0), ServerVersion.parse("15"));
  }

  @Test
  void rejectsTextWithoutNumbers() {
    assertThrows(IllegalArgumentException.class, () -> ServerVersion.parse("unknown"));
    assertThrows(IllegalArgumentException.class, () -> ServerVersion.parse(null));
  }

  @Test
  void comparesComponentWise() {
    ServerVersion v = ServerVersion.of(8, 0, 31);
    assertTrue(v.atLeast(8, 0));
    assertTrue(v.atLeast(8, 0, 31));
    assertFalse(v.atLeast(8, 0, 32));
    assertFalse(v.atLeast(8, 1));
    assertTrue(ServerVersion.of(10, 2).compareTo(ServerVersion.of(9, 9, 9)) > 0);
  }
}
