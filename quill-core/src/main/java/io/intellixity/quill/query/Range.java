package io.intellixity.quill.query;

import java.util.Objects;

/** {@code column BETWEEN low AND high}. Bounds are not reordered; low > high simply matches nothing. */
public record Range(ColumnRef column, Literal low, Literal high) implements Predicate {
  public Range {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(low, "low");
    Objects.requireNonNull(high, "high");
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
