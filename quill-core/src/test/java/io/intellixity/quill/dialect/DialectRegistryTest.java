package io.intellixity.quill.dialect;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DialectRegistryTest {

  @Test
  void builtInCapabilityTable() {
    assertTrue(Dialects.POSTGRES.supportsReturning());
    assertTrue(Dialects.POSTGRES.supportsIlike());
    assertTrue(Dialects.POSTGRES.supportsFullJoin());
    assertFalse(Dialects.POSTGRES.supportsUpdateLimit());
    assertEquals("$3", Dialects.POSTGRES.placeholder(3));

    assertFalse(Dialects.MYSQL.supportsReturning());
    assertFalse(Dialects.MYSQL.supportsIlike());
    assertFalse(Dialects.MYSQL.supportsFullJoin());
    assertTrue(Dialects.MYSQL.supportsUpdateLimit());
    assertTrue(Dialects.MYSQL.supportsDeleteLimit());
    assertEquals("?", Dialects.MYSQL.placeholder(3));

    assertTrue(Dialects.SQLITE.supportsReturning());
    assertFalse(Dialects.SQLITE.supportsIlike());
    assertFalse(Dialects.SQLITE.supportsDeleteLimit());
  }

  @Test
  void quotingDoublesEmbeddedQuotes() {
    assertEquals("\"we\"\"ird\"", Dialects.POSTGRES.quoteIdent("we\"ird"));
    assertEquals("`we``ird`", Dialects.MYSQL.quoteIdent("we`ird"));
  }

  @Test
  void discoversProvidersFromFactoriesFile() {
    DialectRegistry reg = new DialectRegistry();
    assertSame(Dialects.POSTGRES, reg.get("postgres"));
    assertSame(Dialects.MYSQL, reg.get(" MySQL "));
    assertEquals(TestDialectProvider.H2, reg.get("h2"));
    assertTrue(reg.ids().containsAll(List.of("postgres", "mysql", "sqlite", "h2")));
  }

  @Test
  void unknownIdFails() {
    DialectRegistry reg = new DialectRegistry(List.of());
    assertThrows(IllegalArgumentException.class, () -> reg.get("oracle"));
    assertTrue(reg.find("oracle").isEmpty());
  }

  @Test
  void duplicateIdFailsFast() {
    DialectProvider dup = () -> List.of(Dialect.builder("postgres").build());
    assertThrows(IllegalArgumentException.class, () -> new DialectRegistry(List.of(dup)));
  }
}
