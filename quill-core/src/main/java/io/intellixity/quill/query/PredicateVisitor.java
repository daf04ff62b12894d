package io.intellixity.quill.query;

public interface PredicateVisitor<R> {
  R visit(Comparison comparison);
  R visit(PatternMatch pattern);
  R visit(NullCheck nullCheck);
  R visit(Membership membership);
  R visit(Range range);
  R visit(LogicalGroup group);
}
