package io.intellixity.quill.stmt;

import io.intellixity.quill.query.Predicate;
import io.intellixity.quill.schema.TableSchema;

import java.util.Objects;

public record JoinClause(JoinKind kind, TableSchema table, Predicate on) {
  public JoinClause {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(on, "on");
  }
}
