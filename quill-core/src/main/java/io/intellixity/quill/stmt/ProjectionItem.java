package io.intellixity.quill.stmt;

import io.intellixity.quill.errors.QueryConstructionException;
import io.intellixity.quill.query.ColumnRef;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One selected column as written by the caller.
 * <p>
 * {@code table} is null when the item names a bare column; it is then resolved against the base table at
 * compile time. {@code qualified} records whether the caller wrote the table prefix, which decides the result key.
 */
public record ProjectionItem(String table, String column, String alias, boolean qualified) {
  private static final Pattern AS = Pattern.compile("\\s+(?i:as)(?:\\s+|$)");

  public ProjectionItem {
    Objects.requireNonNull(column, "column");
  }

  public static ProjectionItem of(ColumnRef ref) {
    Objects.requireNonNull(ref, "ref");
    return new ProjectionItem(ref.table(), ref.column(), ref.alias(), ref.isQualified());
  }

  /** Parses {@code col}, {@code table.col}, {@code col AS alias} and {@code table.col AS alias}. */
  public static ProjectionItem parse(String text) {
    if (text == null || text.isBlank()) throw new QueryConstructionException("Projection item must not be blank");
    String[] parts = AS.split(text.trim(), -1);
    if (parts.length > 2 || parts[0].isBlank() || (parts.length == 2 && parts[1].isBlank())) {
      throw new QueryConstructionException("Malformed projection item: '" + text + "'");
    }
    String colPart = parts[0].trim();
    String alias = parts.length == 2 ? parts[1].trim() : null;

    int dot = colPart.lastIndexOf('.');
    if (dot < 0) return new ProjectionItem(null, colPart, alias, false);
    String table = colPart.substring(0, dot);
    String column = colPart.substring(dot + 1);
    if (table.isEmpty() || column.isEmpty()) {
      throw new QueryConstructionException("Malformed projection item: '" + text + "'");
    }
    return new ProjectionItem(table, column, alias, true);
  }

  /** Column reference for this item once its table is known. */
  public ColumnRef resolve(String baseTable) {
    ColumnRef ref = new ColumnRef(table == null ? baseTable : table, column);
    if (alias != null) ref = ref.as(alias);
    return qualified ? ref.qualified() : ref;
  }
}
