package io.intellixity.quill.query;

import java.util.Objects;

/** LIKE (case-sensitive) or ILIKE (case-insensitive, dialect-dependent). */
public record PatternMatch(ColumnRef column, Literal pattern, boolean caseSensitive) implements Predicate {
  public PatternMatch {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(pattern, "pattern");
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
