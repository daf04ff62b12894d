package io.intellixity.quill.stmt;

import io.intellixity.quill.Quill;
import io.intellixity.quill.query.Predicate;
import io.intellixity.quill.schema.TableSchema;

import java.util.Map;

public final class UpdateBuilder extends AbstractMutationBuilder<UpdateBuilder> {

  public UpdateBuilder(Quill quill, TableSchema table) {
    super(quill, StatementKind.UPDATE, table);
  }

  @Override protected UpdateBuilder self() { return this; }

  /** Column assignments; {@code null} values assign SQL NULL. Repeated calls merge, later keys win. */
  public UpdateBuilder set(Map<String, ?> assignments) {
    checkOpen();
    state.mergeSet(toLiterals(assignments, "Update payload"));
    return this;
  }

  public UpdateBuilder where(Predicate... predicates) { return addWhere(predicates); }

  /** Compiles only on dialects with LIMIT support on UPDATE. */
  public UpdateBuilder limit(long limit) { return setLimit(limit); }

  @Override
  protected void validate() {
    if (!state.rows().isEmpty()) quill.validator().validateUpdate(state.table(), state.rows().get(0));
  }
}
