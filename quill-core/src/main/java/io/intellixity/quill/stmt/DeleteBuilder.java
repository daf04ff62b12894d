package io.intellixity.quill.stmt;

import io.intellixity.quill.Quill;
import io.intellixity.quill.query.Predicate;
import io.intellixity.quill.schema.TableSchema;

/** Without a where() every row of the table is deleted. */
public final class DeleteBuilder extends AbstractMutationBuilder<DeleteBuilder> {

  public DeleteBuilder(Quill quill, TableSchema table) {
    super(quill, StatementKind.DELETE, table);
  }

  @Override protected DeleteBuilder self() { return this; }

  public DeleteBuilder where(Predicate... predicates) { return addWhere(predicates); }

  /** Compiles only on dialects with LIMIT support on DELETE. */
  public DeleteBuilder limit(long limit) { return setLimit(limit); }
}
