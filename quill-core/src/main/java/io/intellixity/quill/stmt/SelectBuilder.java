package io.intellixity.quill.stmt;

import io.intellixity.quill.Quill;
import io.intellixity.quill.compile.CompiledStatement;
import io.intellixity.quill.errors.QueryConstructionException;
import io.intellixity.quill.exec.CallingConvention;
import io.intellixity.quill.mapping.RecordHydrator;
import io.intellixity.quill.query.ColumnRef;
import io.intellixity.quill.query.Predicate;
import io.intellixity.quill.query.SortField;
import io.intellixity.quill.schema.TableSchema;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

public final class SelectBuilder extends AbstractStatementBuilder<SelectBuilder> {

  /**
   * @param items projection: {@link ColumnRef}s or strings ({@code "col"}, {@code "table.col"},
   *              {@code "col AS alias"}, {@code "table.col AS alias"}); none selects every column
   */
  public SelectBuilder(Quill quill, boolean distinct, Object... items) {
    super(quill, StatementKind.SELECT);
    state.distinct(distinct);
    if (items == null) return;
    for (Object item : items) {
      if (item instanceof ColumnRef ref) state.addProjection(ProjectionItem.of(ref));
      else if (item instanceof String s) state.addProjection(ProjectionItem.parse(s));
      else if (item == null) throw new QueryConstructionException("Projection item must not be null");
      else throw new QueryConstructionException("Unsupported projection item: " + item.getClass().getName());
    }
  }

  @Override protected SelectBuilder self() { return this; }

  public SelectBuilder from(TableSchema table) {
    checkOpen();
    Objects.requireNonNull(table, "table");
    if (state.table() != null) throw new QueryConstructionException("FROM already set to '" + state.table().name() + "'");
    state.table(table);
    return this;
  }

  public SelectBuilder innerJoin(TableSchema table, Predicate on) { return join(JoinKind.INNER, table, on); }
  public SelectBuilder leftJoin(TableSchema table, Predicate on) { return join(JoinKind.LEFT, table, on); }
  public SelectBuilder rightJoin(TableSchema table, Predicate on) { return join(JoinKind.RIGHT, table, on); }

  /** Compiles only on dialects with FULL JOIN support. */
  public SelectBuilder fullJoin(TableSchema table, Predicate on) { return join(JoinKind.FULL, table, on); }

  private SelectBuilder join(JoinKind kind, TableSchema table, Predicate on) {
    checkOpen();
    Objects.requireNonNull(table, "table");
    if (on == null) throw new QueryConstructionException(kind.sql() + " requires a join predicate");
    if (state.table() == null) throw new QueryConstructionException(kind.sql() + " before from()");
    for (TableSchema t : state.tables()) {
      if (t.name().equals(table.name())) {
        throw new QueryConstructionException("Table '" + table.name() + "' is already part of this statement");
      }
    }
    state.addJoin(new JoinClause(kind, table, on));
    return this;
  }

  /** Multiple predicates, and repeated calls, are combined with AND in call order. */
  public SelectBuilder where(Predicate... predicates) { return addWhere(predicates); }

  public SelectBuilder orderBy(SortField... fields) {
    checkOpen();
    if (fields == null || fields.length == 0) throw new QueryConstructionException("orderBy() requires at least one field");
    for (SortField f : fields) {
      if (f == null) throw new QueryConstructionException("orderBy() does not accept null fields");
      state.addOrderBy(f);
    }
    return this;
  }

  /** Ascending order on the given columns. */
  public SelectBuilder orderBy(ColumnRef... columns) {
    checkOpen();
    if (columns == null || columns.length == 0) throw new QueryConstructionException("orderBy() requires at least one column");
    for (ColumnRef c : columns) {
      if (c == null) throw new QueryConstructionException("orderBy() does not accept null columns");
      state.addOrderBy(new SortField(c.unaliased(), SortField.Direction.ASC));
    }
    return this;
  }

  public SelectBuilder limit(long limit) { return setLimit(limit); }

  public SelectBuilder offset(long offset) {
    checkOpen();
    if (offset < 0) throw new QueryConstructionException("offset must be non-negative, got " + offset);
    state.offset(offset);
    return this;
  }

  // ---- triggers ----

  public List<Map<String, Object>> fetch() {
    CompiledStatement c = consume(CallingConvention.BLOCKING);
    return quill.materializer().toMaps(c, quill.bridge().run(c));
  }

  public CompletableFuture<List<Map<String, Object>>> fetchAsync() {
    CompiledStatement c = consume(CallingConvention.NON_BLOCKING);
    return quill.bridge().runAsync(c).thenApply(raw -> quill.materializer().toMaps(c, raw));
  }

  public <T> List<T> fetchInto(RecordHydrator<T> hydrator) {
    Objects.requireNonNull(hydrator, "hydrator");
    return quill.materializer().toRecords(fetch(), hydrator);
  }

  public <T> CompletableFuture<List<T>> fetchIntoAsync(RecordHydrator<T> hydrator) {
    Objects.requireNonNull(hydrator, "hydrator");
    return fetchAsync().thenApply(rows -> quill.materializer().toRecords(rows, hydrator));
  }

  /** Records built by the base table's hydrator. */
  public <T> List<T> fetchRecords() {
    RecordHydrator<T> h = baseHydrator();
    return fetchInto(h);
  }

  public <T> CompletableFuture<List<T>> fetchRecordsAsync() {
    RecordHydrator<T> h = baseHydrator();
    return fetchIntoAsync(h);
  }

  @SuppressWarnings("unchecked")
  private <T> RecordHydrator<T> baseHydrator() {
    TableSchema base = state.table();
    if (base == null) throw new QueryConstructionException("No table selected");
    return (RecordHydrator<T>) base.hydrator()
        .orElseThrow(() -> new QueryConstructionException("Table '" + base.name() + "' has no record hydrator"));
  }
}
