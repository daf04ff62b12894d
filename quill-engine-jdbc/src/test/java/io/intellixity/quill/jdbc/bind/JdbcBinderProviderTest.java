package io.intellixity.quill.jdbc.bind;

import io.intellixity.quill.query.Literal;
import io.intellixity.quill.spi.bind.BindContext;
import io.intellixity.quill.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.quill.stmt.StatementKind;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class JdbcBinderProviderTest {
  private final DiscoveredBinderRegistry binders = new DiscoveredBinderRegistry("mysql");

  private static JdbcBindContext at(int pos) {
    return new DefaultJdbcBindContext(StatementKind.SELECT, pos);
  }

  @Test
  void globalProviderIsDiscovered() {
    List<?> bs = List.copyOf(new DefaultJdbcBinderProvider().binders());
    assertEquals(DiscoveredBinderRegistry.GLOBAL_DIALECT, new DefaultJdbcBinderProvider().dialectId());
    assertInstanceOf(JdbcBinderProvider.JdbcNullBinder.class, bs.get(0));
    assertInstanceOf(JdbcBinderProvider.JdbcSetObjectBinder.class, bs.get(bs.size() - 1));
  }

  @Test
  void scalarsUseSetObject() throws SQLException {
    PreparedStatement ps = mock(PreparedStatement.class);
    binders.bind(ps, at(1), Literal.of("x"));
    binders.bind(ps, at(2), Literal.of(true));
    binders.bind(ps, at(3), Literal.of(2.5));
    verify(ps).setObject(1, "x");
    verify(ps).setObject(2, true);
    verify(ps).setObject(3, 2.5);
  }

  @Test
  void nullUsesSetNull() throws SQLException {
    PreparedStatement ps = mock(PreparedStatement.class);
    binders.bind(ps, at(4), Literal.NULL);
    verify(ps).setNull(4, Types.NULL);
    verifyNoMoreInteractions(ps);
  }

  @Test
  void bigIntegerBindsAsNumeric() throws SQLException {
    PreparedStatement ps = mock(PreparedStatement.class);
    binders.bind(ps, at(1), Literal.of(new BigInteger("123456789012345678901234567890")));
    verify(ps).setBigDecimal(1, new BigDecimal("123456789012345678901234567890"));
  }

  @Test
  void structuredBindsAsJsonText() throws SQLException {
    PreparedStatement ps = mock(PreparedStatement.class);
    binders.bind(ps, at(1), Literal.of(List.of(1, "two")));
    verify(ps).setString(1, "[1,\"two\"]");
  }

  @Test
  void structuredScalarsBindAsJsonScalars() throws SQLException {
    PreparedStatement ps = mock(PreparedStatement.class);
    binders.bind(ps, at(1), Literal.structured("42"));
    binders.bind(ps, at(2), Literal.structured(new BigInteger("7")));
    verify(ps).setString(1, "\"42\"");
    verify(ps).setString(2, "7");
    verify(ps, never()).setBigDecimal(anyInt(), any());
  }

  @Test
  void jdbcBindersNeedPosition() {
    PreparedStatement ps = mock(PreparedStatement.class);
    BindContext plain = () -> StatementKind.SELECT;
    assertThrows(IllegalArgumentException.class, () -> binders.bind(ps, plain, Literal.of("x")));
  }

  @Test
  void bindContextValidatesPosition() {
    assertThrows(IllegalArgumentException.class, () -> new DefaultJdbcBindContext(StatementKind.INSERT, 0));
    assertThrows(IllegalArgumentException.class, () -> new DefaultJdbcBindContext(null, 1));
  }
}
