package io.intellixity.quill.compile;

import io.intellixity.quill.query.ColumnRef;
import io.intellixity.quill.query.Literal;
import io.intellixity.quill.schema.TableSchema;
import io.intellixity.quill.stmt.StatementKind;

import java.util.List;
import java.util.Objects;

/**
 * SQL text plus its ordered parameters. The Nth placeholder in {@link #sql()} binds {@code params().get(N-1)}.
 * <p>
 * {@link #projection()} lists the result columns as the caller named them (alias, qualification); it is empty
 * when the statement selects or returns {@code *}, in which case result keys come from the driver's labels.
 * {@link #tables()} holds the base table followed by joined tables, for result decoding.
 */
public record CompiledStatement(String sql,
                                List<Literal> params,
                                ExecKind execKind,
                                StatementKind kind,
                                List<ColumnRef> projection,
                                List<TableSchema> tables) {
  public enum ExecKind {
    /** Produces rows (SELECT, DML with RETURNING). */
    QUERY,
    /** Produces an update count only. */
    UPDATE
  }

  public CompiledStatement {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(execKind, "execKind");
    Objects.requireNonNull(kind, "kind");
    params = params == null ? List.of() : List.copyOf(params);
    projection = projection == null ? List.of() : List.copyOf(projection);
    tables = tables == null ? List.of() : List.copyOf(tables);
  }

  public boolean returnsRows() { return execKind == ExecKind.QUERY; }

  /** Raw parameter values in bind order. */
  public List<Object> paramValues() {
    return params.stream().map(Literal::value).toList();
  }
}
