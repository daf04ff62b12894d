package io.intellixity.quill.errors;

import io.intellixity.quill.query.LiteralType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A payload value does not match its column's semantic type or nullability.
 * <p>
 * {@link #rowIndex()} is -1 for single-row payloads (update) and the zero-based row for inserts.
 */
public final class TypeMismatchException extends QuillException {
  private final String column;
  private final Set<LiteralType> expected;
  private final LiteralType actual;
  private final int rowIndex;

  public TypeMismatchException(String column, Set<LiteralType> expected, LiteralType actual, int rowIndex) {
    super(message(column, expected, actual, rowIndex));
    this.column = column;
    this.expected = Collections.unmodifiableSet(EnumSet.copyOf(expected));
    this.actual = actual;
    this.rowIndex = rowIndex;
  }

  public String column() { return column; }
  public Set<LiteralType> expected() { return expected; }
  public LiteralType actual() { return actual; }
  public int rowIndex() { return rowIndex; }
  public boolean hasRowIndex() { return rowIndex >= 0; }

  private static String message(String column, Set<LiteralType> expected, LiteralType actual, int rowIndex) {
    String msg = "Type mismatch for column '" + column + "': expected one of " + expected + " but got " + actual;
    return rowIndex >= 0 ? msg + " (row " + rowIndex + ")" : msg;
  }
}
