package io.intellixity.quill.query;

/** Immutable boolean node of a WHERE or JOIN condition tree. */
public interface Predicate {
  <R> R accept(PredicateVisitor<R> visitor);
}
