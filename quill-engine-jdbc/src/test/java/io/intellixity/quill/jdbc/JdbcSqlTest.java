package io.intellixity.quill.jdbc;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcSqlTest {

  @Test
  void rewritesNumberedPlaceholders() {
    JdbcSql s = JdbcSql.rewrite("SELECT * FROM \"users\" WHERE \"age\" > $1 AND \"name\" = $2");
    assertEquals("SELECT * FROM \"users\" WHERE \"age\" > ? AND \"name\" = ?", s.sql());
    assertEquals(List.of(0, 1), s.paramOrder());
  }

  @Test
  void keepsPlaceholderNumbersWhenOutOfOrder() {
    JdbcSql s = JdbcSql.rewrite("SELECT $2, $1, $10");
    assertEquals("SELECT ?, ?, ?", s.sql());
    assertEquals(List.of(1, 0, 9), s.paramOrder());
  }

  @Test
  void ignoresPlaceholdersInsideQuotes() {
    JdbcSql s = JdbcSql.rewrite("SELECT '$1 it''s ?', \"col$2\", `x?` FROM t WHERE a = $1");
    assertEquals("SELECT '$1 it''s ?', \"col$2\", `x?` FROM t WHERE a = ?", s.sql());
    assertEquals(List.of(0), s.paramOrder());
  }

  @Test
  void questionMarksBindInAppearanceOrder() {
    JdbcSql s = JdbcSql.rewrite("UPDATE `users` SET `age` = ? WHERE `id` = ? LIMIT 1");
    assertEquals("UPDATE `users` SET `age` = ? WHERE `id` = ? LIMIT 1", s.sql());
    assertEquals(List.of(0, 1), s.paramOrder());
  }

  @Test
  void dollarWithoutDigitsIsText() {
    JdbcSql s = JdbcSql.rewrite("SELECT $ FROM t");
    assertEquals("SELECT $ FROM t", s.sql());
    assertTrue(s.paramOrder().isEmpty());
  }

  @Test
  void zeroPlaceholderIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> JdbcSql.rewrite("SELECT $0"));
  }

  @Test
  void nullSqlIsEmpty() {
    assertEquals("", JdbcSql.rewrite(null).sql());
  }
}
