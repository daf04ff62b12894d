package io.intellixity.quill.query;

import java.util.List;
import java.util.Objects;

/**
 * {@code column [NOT] IN (...)}.
 * <p>
 * An empty value list is legal and renders as a constant: FALSE for IN, TRUE for NOT IN.
 */
public record Membership(ColumnRef column, List<Literal> values, boolean negated) implements Predicate {
  public Membership {
    Objects.requireNonNull(column, "column");
    values = List.copyOf(values == null ? List.of() : values);
  }

  public boolean isEmpty() { return values.isEmpty(); }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
