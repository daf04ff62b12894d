package io.intellixity.quill.validate;

import io.intellixity.quill.errors.TypeMismatchException;
import io.intellixity.quill.query.Literal;
import io.intellixity.quill.query.LiteralType;
import io.intellixity.quill.schema.ColumnDef;
import io.intellixity.quill.schema.SemanticType;
import io.intellixity.quill.schema.TableSchema;

import java.util.*;

/**
 * Checks insert/update payloads against column semantic types and nullability.
 * <p>
 * Rows are walked in order; within a row, undeclared keys are rejected first, then assigned columns are checked
 * in declaration order. The first failure is raised. Columns absent from a row are not checked.
 */
public final class ValueValidator {
  private static final Map<SemanticType, Set<LiteralType>> ACCEPTED = new EnumMap<>(SemanticType.class);

  static {
    ACCEPTED.put(SemanticType.TEXT, EnumSet.of(LiteralType.TEXT));
    ACCEPTED.put(SemanticType.INTEGER, EnumSet.of(LiteralType.INTEGER));
    ACCEPTED.put(SemanticType.FLOAT, EnumSet.of(LiteralType.FLOAT, LiteralType.INTEGER));
    ACCEPTED.put(SemanticType.BOOLEAN, EnumSet.of(LiteralType.BOOLEAN));
    // JSON scalars are valid structured values
    ACCEPTED.put(SemanticType.STRUCTURED, EnumSet.of(LiteralType.STRUCTURED, LiteralType.TEXT,
        LiteralType.INTEGER, LiteralType.FLOAT, LiteralType.BOOLEAN));
    ACCEPTED.put(SemanticType.FOREIGN_KEY, EnumSet.of(LiteralType.INTEGER));
  }

  /** Literal types a column accepts, NULL included for nullable columns. */
  public static Set<LiteralType> accepted(ColumnDef column) {
    Objects.requireNonNull(column, "column");
    EnumSet<LiteralType> out = EnumSet.copyOf(ACCEPTED.get(column.type()));
    if (column.nullable()) out.add(LiteralType.NULL);
    return Collections.unmodifiableSet(out);
  }

  public void validateInsert(TableSchema table, List<Map<String, Literal>> rows) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(rows, "rows");
    for (int i = 0; i < rows.size(); i++) validateRow(table, rows.get(i), i);
  }

  public void validateUpdate(TableSchema table, Map<String, Literal> assignments) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(assignments, "assignments");
    validateRow(table, assignments, -1);
  }

  private static void validateRow(TableSchema table, Map<String, Literal> row, int rowIndex) {
    for (String key : row.keySet()) table.column(key);
    for (ColumnDef c : table.columns()) {
      if (!row.containsKey(c.name())) continue;
      Literal v = row.get(c.name());
      LiteralType actual = v == null ? LiteralType.NULL : v.type();
      Set<LiteralType> expected = accepted(c);
      if (!expected.contains(actual)) throw new TypeMismatchException(c.name(), expected, actual, rowIndex);
    }
  }
}
