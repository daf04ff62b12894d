package io.intellixity.quill.jdbc;

import io.intellixity.quill.compile.CompiledStatement;
import io.intellixity.quill.dialect.Dialect;
import io.intellixity.quill.exec.RawRows;
import io.intellixity.quill.jdbc.bind.DefaultJdbcBindContext;
import io.intellixity.quill.query.Literal;
import io.intellixity.quill.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.quill.spi.exec.AbstractExecutionCollaborator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * JDBC execution collaborator. One connection is taken from the {@link DataSource} per statement and closed
 * afterwards; statements run in auto-commit mode.
 * <p>
 * JDBC is a blocking API, so the non-blocking variant runs the whole connection lifecycle on the supplied worker.
 */
public final class JdbcExecutor extends AbstractExecutionCollaborator<Connection> {
  private static final Logger log = LoggerFactory.getLogger(JdbcExecutor.class);

  private final DataSource ds;
  private final DiscoveredBinderRegistry binders;

  private JdbcExecutor(DataSource ds, DiscoveredBinderRegistry binders) {
    super();
    this.ds = Objects.requireNonNull(ds, "ds");
    this.binders = Objects.requireNonNull(binders, "binders");
  }

  private JdbcExecutor(DataSource ds, DiscoveredBinderRegistry binders, Executor worker) {
    super(worker);
    this.ds = Objects.requireNonNull(ds, "ds");
    this.binders = Objects.requireNonNull(binders, "binders");
  }

  public static JdbcExecutor blocking(DataSource ds, Dialect dialect) {
    Objects.requireNonNull(dialect, "dialect");
    return new JdbcExecutor(ds, new DiscoveredBinderRegistry(dialect.id()));
  }

  public static JdbcExecutor blocking(DataSource ds, DiscoveredBinderRegistry binders) {
    return new JdbcExecutor(ds, binders);
  }

  public static JdbcExecutor nonBlocking(DataSource ds, Dialect dialect, Executor worker) {
    Objects.requireNonNull(dialect, "dialect");
    return new JdbcExecutor(ds, new DiscoveredBinderRegistry(dialect.id()), worker);
  }

  public static JdbcExecutor nonBlocking(DataSource ds, DiscoveredBinderRegistry binders, Executor worker) {
    return new JdbcExecutor(ds, binders, worker);
  }

  @Override
  protected Connection acquire() {
    try {
      return ds.getConnection();
    } catch (SQLException e) {
      throw new JdbcExecutionException("getConnection", e);
    }
  }

  @Override
  protected void release(Connection c) {
    try {
      c.close();
    } catch (SQLException e) {
      throw new JdbcExecutionException("close", e);
    }
  }

  @Override
  protected RawRows run(Connection c, CompiledStatement stmt) {
    String op = stmt.kind().name();
    JdbcSql jdbcSql = JdbcSql.rewrite(stmt.sql());
    if (jdbcSql.paramOrder().size() != stmt.params().size()) {
      throw new IllegalStateException("Placeholder count " + jdbcSql.paramOrder().size()
          + " does not match parameter count " + stmt.params().size());
    }
    long start = System.nanoTime();
    debugSql(op, stmt, jdbcSql.sql());
    try (PreparedStatement ps = c.prepareStatement(jdbcSql.sql())) {
      bindAll(ps, stmt, jdbcSql.paramOrder());
      if (stmt.returnsRows()) {
        try (ResultSet rs = ps.executeQuery()) {
          RawRows out = JdbcRows.read(rs);
          debugDone(op, stmt, out.size(), System.nanoTime() - start);
          return out;
        }
      }
      int n = ps.executeUpdate();
      debugDone(op, stmt, n, System.nanoTime() - start);
      return RawRows.updateCount(n);
    } catch (SQLException e) {
      throw new JdbcExecutionException(op, e);
    }
  }

  private void bindAll(PreparedStatement ps, CompiledStatement stmt, List<Integer> order) {
    for (int i = 0; i < order.size(); i++) {
      Literal l = stmt.params().get(order.get(i));
      binders.bind(ps, new DefaultJdbcBindContext(stmt.kind(), i + 1), l);
    }
  }

  private static void debugSql(String op, CompiledStatement stmt, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("quill.jdbc op={} execKind={} bindCount={} sql={}", op, stmt.execKind(), stmt.params().size(), jdbcSql);

    // TRACE: bind summary only, never raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Literal l : stmt.params()) {
        Object v = l.value();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("quill.jdbc bind index={} literalType={} valueType={} valueLen={}",
            idx++, l.type(), v == null ? "null" : v.getClass().getName(), vLen);
      }
    }
  }

  private static void debugDone(String op, CompiledStatement stmt, int result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("quill.jdbc_done op={} execKind={} durationMs={} result={}",
        op, stmt.execKind(), durationNanos / 1_000_000.0, result);
  }
}
