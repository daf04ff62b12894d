package io.intellixity.quill.stmt;

import io.intellixity.quill.Quill;
import io.intellixity.quill.errors.InconsistentColumnsException;
import io.intellixity.quill.errors.QueryConstructionException;
import io.intellixity.quill.query.Literal;
import io.intellixity.quill.schema.TableSchema;

import java.util.List;
import java.util.Map;

/**
 * {@code INSERT INTO t (cols) VALUES (...), (...)}. Column order follows the first row; every row must carry
 * the same column set.
 */
public final class InsertBuilder extends AbstractMutationBuilder<InsertBuilder> {

  public InsertBuilder(Quill quill, TableSchema table) {
    super(quill, StatementKind.INSERT, table);
  }

  @Override protected InsertBuilder self() { return this; }

  public InsertBuilder values(Map<String, ?> row) {
    checkOpen();
    addRow(row);
    return this;
  }

  /** Appends rows; may be combined with earlier {@code values} calls. */
  public InsertBuilder values(List<? extends Map<String, ?>> rows) {
    checkOpen();
    if (rows == null || rows.isEmpty()) throw new QueryConstructionException("values() requires at least one row");
    for (Map<String, ?> row : rows) addRow(row);
    return this;
  }

  private void addRow(Map<String, ?> row) {
    int index = state.rows().size();
    Map<String, Literal> literals = toLiterals(row, "Insert row " + index);
    if (index > 0) {
      Map<String, Literal> first = state.rows().get(0);
      if (!first.keySet().equals(literals.keySet())) {
        throw new InconsistentColumnsException(index, first.keySet(), literals.keySet());
      }
    }
    state.addRow(literals);
  }

  @Override
  protected void validate() {
    quill.validator().validateInsert(state.table(), state.rows());
  }
}
