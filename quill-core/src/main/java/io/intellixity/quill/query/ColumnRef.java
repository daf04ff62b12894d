package io.intellixity.quill.query;

import java.util.Objects;

/**
 * Immutable reference to a table column, optionally aliased.
 * <p>
 * Two references are equal iff table, column and alias match. The {@link #isQualified()} flag only affects
 * rendering ({@code "table"."column"} instead of {@code "column"}) and result keys, not identity.
 */
public final class ColumnRef implements Operand {
  private final String table;
  private final String column;
  private final String alias;
  private final boolean qualified;

  public ColumnRef(String table, String column) {
    this(table, column, null, false);
  }

  private ColumnRef(String table, String column, String alias, boolean qualified) {
    this.table = Objects.requireNonNull(table, "table");
    this.column = Objects.requireNonNull(column, "column");
    this.alias = alias;
    this.qualified = qualified;
  }

  public String table() { return table; }
  public String column() { return column; }
  /** Alias or null. */
  public String alias() { return alias; }
  public boolean hasAlias() { return alias != null; }
  public boolean isQualified() { return qualified; }

  /** Same column rendered as {@code col AS alias} in a projection. */
  public ColumnRef as(String alias) {
    Objects.requireNonNull(alias, "alias");
    if (alias.isBlank()) throw new IllegalArgumentException("alias must not be blank");
    return new ColumnRef(table, column, alias, qualified);
  }

  /** Same column rendered with its table prefix. */
  public ColumnRef qualified() {
    return qualified ? this : new ColumnRef(table, column, alias, true);
  }

  /** Same column without alias, for use outside projections. */
  public ColumnRef unaliased() {
    return alias == null ? this : new ColumnRef(table, column, null, qualified);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ColumnRef other)) return false;
    return table.equals(other.table) && column.equals(other.column) && Objects.equals(alias, other.alias);
  }

  @Override
  public int hashCode() {
    return Objects.hash(table, column, alias);
  }

  @Override
  public String toString() {
    String s = table + "." + column;
    return alias == null ? s : s + " AS " + alias;
  }
}
