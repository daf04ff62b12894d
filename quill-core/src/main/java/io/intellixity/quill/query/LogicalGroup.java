package io.intellixity.quill.query;

import io.intellixity.quill.errors.QueryConstructionException;

import java.util.List;
import java.util.Objects;

/** Conjunction ({@link Clause#AND}) or disjunction ({@link Clause#OR}) over one or more children. */
public final class LogicalGroup implements Predicate {
  private final Clause clause;
  private final List<Predicate> elements;

  public LogicalGroup(Clause clause, List<Predicate> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    if (elements == null || elements.isEmpty()) {
      throw new QueryConstructionException(clause + " requires at least one predicate");
    }
    for (Predicate p : elements) {
      if (p == null) throw new QueryConstructionException(clause + " does not accept null predicates");
    }
    this.elements = List.copyOf(elements);
  }

  public Clause clause() { return clause; }
  public List<Predicate> elements() { return elements; }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LogicalGroup other)) return false;
    return clause == other.clause && elements.equals(other.elements);
  }

  @Override
  public int hashCode() {
    return Objects.hash(clause, elements);
  }

  @Override
  public String toString() {
    return clause + elements.toString();
  }
}
