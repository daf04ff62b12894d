package io.intellixity.quill.jdbc;

import java.sql.SQLException;

/** Wraps the {@link SQLException} raised by the driver; it is always kept as the cause. */
public final class JdbcExecutionException extends RuntimeException {
  public JdbcExecutionException(String op, SQLException cause) {
    super("JDBC " + op + " failed: " + cause.getMessage(), cause);
  }

  @Override
  public synchronized SQLException getCause() {
    return (SQLException) super.getCause();
  }

  /** SQLSTATE reported by the driver, may be null. */
  public String sqlState() {
    return getCause().getSQLState();
  }
}
