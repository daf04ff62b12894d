package io.intellixity.quill.stmt;

import io.intellixity.quill.Quill;
import io.intellixity.quill.compile.CompiledStatement;
import io.intellixity.quill.errors.QueryConstructionException;
import io.intellixity.quill.exec.CallingConvention;
import io.intellixity.quill.exec.RawRows;
import io.intellixity.quill.schema.TableSchema;

import java.util.*;
import java.util.concurrent.CompletableFuture;

/** Insert/update/delete: RETURNING plus the mutation triggers. */
public abstract class AbstractMutationBuilder<B extends AbstractMutationBuilder<B>> extends AbstractStatementBuilder<B> {

  protected AbstractMutationBuilder(Quill quill, StatementKind kind, TableSchema table) {
    super(quill, kind);
    state.table(Objects.requireNonNull(table, "table"));
  }

  /**
   * Requests RETURNING on dialects that support it. No columns (or {@code "*"}) returns every column.
   * A later call replaces an earlier one.
   */
  public B returning(String... columns) {
    checkOpen();
    List<String> cols = new ArrayList<>();
    if (columns != null) {
      for (String c : columns) {
        if (c == null || c.isBlank()) throw new QueryConstructionException("returning() column must not be blank");
        if ("*".equals(c.trim())) {
          cols.clear();
          break;
        }
        cols.add(c);
      }
    }
    state.returning(cols);
    return self();
  }

  public MutationResult execute() {
    CompiledStatement c = consume(CallingConvention.BLOCKING);
    return toResult(c, quill.bridge().run(c));
  }

  public CompletableFuture<MutationResult> executeAsync() {
    CompiledStatement c = consume(CallingConvention.NON_BLOCKING);
    return quill.bridge().runAsync(c).thenApply(raw -> toResult(c, raw));
  }

  private MutationResult toResult(CompiledStatement c, RawRows raw) {
    if (c.returnsRows()) {
      List<Map<String, Object>> rows = quill.materializer().toMaps(c, raw);
      return new MutationResult(rows.size(), rows);
    }
    return new MutationResult(raw.updateCount(), List.of());
  }
}
