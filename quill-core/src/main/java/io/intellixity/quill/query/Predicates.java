package io.intellixity.quill.query;

import io.intellixity.quill.errors.QueryConstructionException;

import java.util.*;

/**
 * Factory functions for the predicate tree. Pure; nothing here touches a database.
 * <p>
 * Values may be {@link ColumnRef}s (column-to-column conditions, e.g. join predicates) or plain Java values,
 * which are converted with {@link Literal#of(Object)}. {@code eq(col, null)} and {@code ne(col, null)}
 * become {@code IS NULL} / {@code IS NOT NULL}.
 */
public final class Predicates {
  private Predicates() {}

  public static Predicate eq(ColumnRef column, Object value) {
    Operand right = operand(value);
    if (isNullLiteral(right)) return isNull(column);
    return new Comparison(ComparisonOperator.EQ, column, right);
  }

  public static Predicate ne(ColumnRef column, Object value) {
    Operand right = operand(value);
    if (isNullLiteral(right)) return isNotNull(column);
    return new Comparison(ComparisonOperator.NE, column, right);
  }

  public static Comparison lt(ColumnRef column, Object value) { return nonNull(ComparisonOperator.LT, column, value); }
  public static Comparison le(ColumnRef column, Object value) { return nonNull(ComparisonOperator.LE, column, value); }
  public static Comparison gt(ColumnRef column, Object value) { return nonNull(ComparisonOperator.GT, column, value); }
  public static Comparison ge(ColumnRef column, Object value) { return nonNull(ComparisonOperator.GE, column, value); }

  public static PatternMatch like(ColumnRef column, String pattern) {
    return new PatternMatch(column, pattern(pattern), true);
  }

  /** Case-insensitive pattern match; compiles only on dialects with ILIKE support. */
  public static PatternMatch ilike(ColumnRef column, String pattern) {
    return new PatternMatch(column, pattern(pattern), false);
  }

  public static NullCheck isNull(ColumnRef column) { return new NullCheck(column, true); }
  public static NullCheck isNotNull(ColumnRef column) { return new NullCheck(column, false); }

  public static Membership in(ColumnRef column, Collection<?> values) {
    return new Membership(column, literals(values), false);
  }

  public static Membership notIn(ColumnRef column, Collection<?> values) {
    return new Membership(column, literals(values), true);
  }

  public static Range between(ColumnRef column, Object low, Object high) {
    Literal lo = Literal.of(low);
    Literal hi = Literal.of(high);
    if (lo.isNull() || hi.isNull()) {
      throw new QueryConstructionException("BETWEEN requires non-null bounds for column '" + column.column() + "'");
    }
    return new Range(column, lo, hi);
  }

  public static LogicalGroup and(Predicate... predicates) {
    return new LogicalGroup(Clause.AND, predicates == null ? List.of() : Arrays.asList(predicates));
  }

  public static LogicalGroup or(Predicate... predicates) {
    return new LogicalGroup(Clause.OR, predicates == null ? List.of() : Arrays.asList(predicates));
  }

  public static SortField asc(ColumnRef column) { return new SortField(column, SortField.Direction.ASC); }
  public static SortField desc(ColumnRef column) { return new SortField(column, SortField.Direction.DESC); }

  public static ColumnRef alias(ColumnRef column, String alias) { return column.as(alias); }

  private static Comparison nonNull(ComparisonOperator op, ColumnRef column, Object value) {
    Operand right = operand(value);
    if (isNullLiteral(right)) {
      throw new QueryConstructionException(op + " requires a non-null value for column '" + column.column() + "'");
    }
    return new Comparison(op, column, right);
  }

  private static Operand operand(Object value) {
    if (value instanceof ColumnRef c) return c.unaliased();
    return Literal.of(value);
  }

  private static boolean isNullLiteral(Operand o) {
    return o instanceof Literal l && l.isNull();
  }

  private static Literal pattern(String pattern) {
    if (pattern == null) throw new QueryConstructionException("pattern must not be null");
    return Literal.text(pattern);
  }

  private static List<Literal> literals(Collection<?> values) {
    if (values == null) throw new QueryConstructionException("membership values must not be null");
    List<Literal> out = new ArrayList<>(values.size());
    for (Object v : values) out.add(Literal.of(v));
    return out;
  }
}
