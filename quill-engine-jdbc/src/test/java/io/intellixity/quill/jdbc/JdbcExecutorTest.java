package io.intellixity.quill.jdbc;

import io.intellixity.quill.Quill;
import io.intellixity.quill.dialect.Dialects;
import io.intellixity.quill.exec.CallingConvention;
import io.intellixity.quill.schema.SemanticType;
import io.intellixity.quill.schema.TableSchema;
import io.intellixity.quill.stmt.MutationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;

import javax.sql.DataSource;
import java.sql.*;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.intellixity.quill.query.Predicates.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

final class JdbcExecutorTest {
  static final TableSchema USERS = TableSchema.builder("users")
      .primaryKey("id", SemanticType.INTEGER)
      .column("name", SemanticType.TEXT, false)
      .column("age", SemanticType.INTEGER, true)
      .column("profile", SemanticType.STRUCTURED, true)
      .build();

  private DataSource ds;
  private Connection conn;
  private PreparedStatement ps;
  private ExecutorService worker;

  @BeforeEach
  void setUp() throws SQLException {
    ds = mock(DataSource.class);
    conn = mock(Connection.class);
    ps = mock(PreparedStatement.class);
    when(ds.getConnection()).thenReturn(conn);
    when(conn.prepareStatement(anyString())).thenReturn(ps);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    if (worker != null) {
      worker.shutdownNow();
      assertTrue(worker.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  private ResultSet userResultSet() throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    ResultSetMetaData md = mock(ResultSetMetaData.class);
    when(rs.getMetaData()).thenReturn(md);
    when(md.getColumnCount()).thenReturn(3);
    when(md.getTableName(anyInt())).thenReturn("users");
    when(md.getColumnLabel(1)).thenReturn("id");
    when(md.getColumnLabel(2)).thenReturn("name");
    when(md.getColumnLabel(3)).thenReturn("profile");
    when(md.getColumnTypeName(1)).thenReturn("int4");
    when(md.getColumnTypeName(2)).thenReturn("text");
    when(md.getColumnTypeName(3)).thenReturn("jsonb");
    when(rs.next()).thenReturn(true, true, false);
    when(rs.getObject(1)).thenReturn(1L, 2L);
    when(rs.getObject(2)).thenReturn("Ann", "Bob");
    when(rs.getString(3)).thenReturn("{\"tier\":\"gold\"}", null);
    return rs;
  }

  @Test
  void selectBindsRewritesAndMaterializes() throws SQLException {
    ResultSet rs = userResultSet();
    when(ps.executeQuery()).thenReturn(rs);
    Quill q = Quill.builder().dialect(Dialects.POSTGRES).executor(JdbcExecutor.blocking(ds, Dialects.POSTGRES)).build();

    List<Map<String, Object>> rows = q.select("id", "name", "profile").from(USERS)
        .where(gt(USERS.col("age"), 18), like(USERS.col("name"), "A%"))
        .fetch();

    verify(conn).prepareStatement("SELECT \"id\", \"name\", \"profile\" FROM \"users\" WHERE (\"age\" > ?) AND (\"name\" LIKE ?)");
    verify(ps).setObject(1, 18);
    verify(ps).setObject(2, "A%");
    verify(rs).close();
    verify(ps).close();
    verify(conn).close();

    assertEquals(2, rows.size());
    assertEquals("Ann", rows.get(0).get("name"));
    assertEquals(Map.of("tier", "gold"), rows.get(0).get("profile"));
    assertNull(rows.get(1).get("profile"));
  }

  @Test
  void insertUsesUpdateCountAndTypedBinders() throws SQLException {
    when(ps.executeUpdate()).thenReturn(1);
    Quill q = Quill.builder().dialect(Dialects.SQLITE).executor(JdbcExecutor.blocking(ds, Dialects.SQLITE)).build();

    Map<String, Object> row = new LinkedHashMap<>();
    row.put("name", "Ann");
    row.put("age", null);
    row.put("profile", Map.of("tier", "gold"));
    MutationResult r = q.insert(USERS).values(row).execute();

    assertEquals(1, r.affectedRows());
    assertTrue(r.returning().isEmpty());
    verify(conn).prepareStatement("INSERT INTO \"users\" (\"name\", \"age\", \"profile\") VALUES (?, ?, ?)");
    verify(ps).setObject(1, "Ann");
    verify(ps).setNull(2, Types.NULL);
    verify(ps).setString(3, "{\"tier\":\"gold\"}");
    verify(ps, never()).executeQuery();
    verify(conn).close();
  }

  @Test
  void textWrittenToStructuredColumnIsStoredAsJsonString() throws SQLException {
    when(ps.executeUpdate()).thenReturn(1);
    Quill q = Quill.builder().dialect(Dialects.SQLITE).executor(JdbcExecutor.blocking(ds, Dialects.SQLITE)).build();

    q.insert(USERS).values(Map.of("name", "Ann", "profile", "42")).execute();

    verify(ps).setString(anyInt(), ArgumentMatchers.eq("\"42\""));
    verify(ps, never()).setObject(anyInt(), ArgumentMatchers.eq("42"));
  }

  @Test
  void returningRunsAsQuery() throws SQLException {
    ResultSet rs = userResultSet();
    when(ps.executeQuery()).thenReturn(rs);
    Quill q = Quill.builder().dialect(Dialects.POSTGRES).executor(JdbcExecutor.blocking(ds, Dialects.POSTGRES)).build();

    MutationResult r = q.delete(USERS).where(lt(USERS.col("age"), 3)).returning().execute();

    assertEquals(2, r.affectedRows());
    assertEquals(2L, r.returning().get(1).get("id"));
    verify(conn).prepareStatement("DELETE FROM \"users\" WHERE \"age\" < ? RETURNING *");
    verify(ps, never()).executeUpdate();
  }

  @Test
  void driverFailureIsWrappedOnceAndConnectionClosed() throws SQLException {
    SQLException unique = new SQLException("duplicate key", "23505");
    when(ps.executeUpdate()).thenThrow(unique);
    Quill q = Quill.builder().dialect(Dialects.POSTGRES).executor(JdbcExecutor.blocking(ds, Dialects.POSTGRES)).build();

    JdbcExecutionException e = assertThrows(JdbcExecutionException.class,
        () -> q.update(USERS).set(Map.of("age", 30)).where(eq(USERS.col("id"), 1)).execute());
    assertSame(unique, e.getCause());
    assertEquals("23505", e.sqlState());
    verify(conn).close();
  }

  @Test
  void closeFailureDoesNotHideStatementFailure() throws SQLException {
    SQLException unique = new SQLException("duplicate key", "23505");
    SQLException closeFailed = new SQLException("connection reset", "08006");
    when(ps.executeUpdate()).thenThrow(unique);
    doThrow(closeFailed).when(conn).close();
    Quill q = Quill.builder().dialect(Dialects.POSTGRES).executor(JdbcExecutor.blocking(ds, Dialects.POSTGRES)).build();

    JdbcExecutionException e = assertThrows(JdbcExecutionException.class,
        () -> q.delete(USERS).where(eq(USERS.col("id"), 1)).execute());
    assertSame(unique, e.getCause());
    assertEquals(1, e.getSuppressed().length);
    assertSame(closeFailed, e.getSuppressed()[0].getCause());
  }

  @Test
  void connectionFailureSurfacesBeforeAnyStatement() throws SQLException {
    SQLException refused = new SQLException("connection refused", "08001");
    when(ds.getConnection()).thenThrow(refused);
    Quill q = Quill.builder().dialect(Dialects.POSTGRES).executor(JdbcExecutor.blocking(ds, Dialects.POSTGRES)).build();

    JdbcExecutionException e = assertThrows(JdbcExecutionException.class, () -> q.select().from(USERS).fetch());
    assertSame(refused, e.getCause());
    verify(conn, never()).prepareStatement(anyString());
  }

  @Test
  void nonBlockingRunsOnWorkerAndReleasesConnection() throws SQLException {
    ResultSet rs = userResultSet();
    when(ps.executeQuery()).thenReturn(rs);
    worker = Executors.newSingleThreadExecutor();
    JdbcExecutor exec = JdbcExecutor.nonBlocking(ds, Dialects.POSTGRES, worker);
    assertEquals(CallingConvention.NON_BLOCKING, exec.convention());
    Quill q = Quill.builder().dialect(Dialects.POSTGRES).executor(exec).build();

    List<Map<String, Object>> rows = q.select().from(USERS).fetchAsync().join();

    assertEquals(2, rows.size());
    assertEquals("Bob", rows.get(1).get("name"));
    verify(conn).close();
  }

  @Test
  void nonBlockingFailureCompletesExceptionally() throws SQLException {
    SQLException boom = new SQLException("timeout");
    when(ps.executeQuery()).thenThrow(boom);
    worker = Executors.newSingleThreadExecutor();
    Quill q = Quill.builder().dialect(Dialects.POSTGRES)
        .executor(JdbcExecutor.nonBlocking(ds, Dialects.POSTGRES, worker)).build();

    CompletionException e = assertThrows(CompletionException.class, () -> q.select().from(USERS).fetchAsync().join());
    assertInstanceOf(JdbcExecutionException.class, e.getCause());
    assertSame(boom, e.getCause().getCause());
    verify(conn).close();
  }
}
