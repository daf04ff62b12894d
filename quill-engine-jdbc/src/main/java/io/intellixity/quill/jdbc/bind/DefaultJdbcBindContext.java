package io.intellixity.quill.jdbc.bind;

import io.intellixity.quill.stmt.StatementKind;

public record DefaultJdbcBindContext(
    StatementKind statementKind,
    int position1Based
) implements JdbcBindContext {
  public DefaultJdbcBindContext {
    if (statementKind == null) throw new IllegalArgumentException("statementKind is required");
    if (position1Based <= 0) throw new IllegalArgumentException("position1Based must be >= 1");
  }
}
