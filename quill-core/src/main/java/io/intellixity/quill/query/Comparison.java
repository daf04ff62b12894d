package io.intellixity.quill.query;

import java.util.Objects;

/** {@code left op right}; the right side is a column for join-style conditions. */
public record Comparison(ComparisonOperator operator, Operand left, Operand right) implements Predicate {
  public Comparison {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
