package io.intellixity.quill.query;

import java.util.Objects;

public record NullCheck(ColumnRef column, boolean isNull) implements Predicate {
  public NullCheck {
    Objects.requireNonNull(column, "column");
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
