package io.intellixity.quill.errors;

import java.util.Set;

/** Bulk insert row whose column set differs from the first row. */
public final class InconsistentColumnsException extends QuillException {
  private final int rowIndex;
  private final Set<String> expected;
  private final Set<String> actual;

  public InconsistentColumnsException(int rowIndex, Set<String> expected, Set<String> actual) {
    super("Insert row " + rowIndex + " has columns " + actual + " but row 0 has " + expected);
    this.rowIndex = rowIndex;
    this.expected = Set.copyOf(expected);
    this.actual = Set.copyOf(actual);
  }

  /** Zero-based index of the offending row. */
  public int rowIndex() { return rowIndex; }
  public Set<String> expected() { return expected; }
  public Set<String> actual() { return actual; }
}
