package io.intellixity.quill.errors;

/** Reference to a column the table schema does not declare. */
public final class UnknownColumnException extends QuillException {
  private final String table;
  private final String column;

  public UnknownColumnException(String table, String column) {
    super("Column '" + column + "' not in table '" + table + "'");
    this.table = table;
    this.column = column;
  }

  public String table() { return table; }
  public String column() { return column; }
}
