package io.intellixity.quill.stmt;

import io.intellixity.quill.query.Literal;
import io.intellixity.quill.query.Predicate;
import io.intellixity.quill.query.SortField;
import io.intellixity.quill.schema.TableSchema;

import java.util.*;

/**
 * Clause accumulator owned by exactly one builder.
 * <p>
 * Mutators are package-private so only builders change the state; readers (the compiler, tests) get
 * unmodifiable views. Not thread-safe.
 */
public final class StatementState {
  private final StatementKind kind;
  private TableSchema table;
  private boolean distinct;
  private final List<ProjectionItem> projection = new ArrayList<>();
  private final List<JoinClause> joins = new ArrayList<>();
  private final List<Predicate> where = new ArrayList<>();
  private final List<SortField> orderBy = new ArrayList<>();
  private Long limit;
  private Long offset;
  private List<String> returning;
  private final List<Map<String, Literal>> rows = new ArrayList<>();

  StatementState(StatementKind kind) {
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public StatementKind kind() { return kind; }
  /** Base table, or null while a select has no FROM yet. */
  public TableSchema table() { return table; }
  public boolean distinct() { return distinct; }
  public List<ProjectionItem> projection() { return Collections.unmodifiableList(projection); }
  public List<JoinClause> joins() { return Collections.unmodifiableList(joins); }
  public List<Predicate> where() { return Collections.unmodifiableList(where); }
  public List<SortField> orderBy() { return Collections.unmodifiableList(orderBy); }
  public Long limit() { return limit; }
  public Long offset() { return offset; }
  /** Null when no RETURNING was requested; empty for {@code RETURNING *}. */
  public List<String> returning() { return returning == null ? null : Collections.unmodifiableList(returning); }
  /** Insert rows, or the single SET row of an update. Rows are read-only views. */
  public List<Map<String, Literal>> rows() {
    List<Map<String, Literal>> out = new ArrayList<>(rows.size());
    for (Map<String, Literal> r : rows) out.add(Collections.unmodifiableMap(r));
    return Collections.unmodifiableList(out);
  }

  /** Base table followed by joined tables, in render order. */
  public List<TableSchema> tables() {
    List<TableSchema> out = new ArrayList<>(1 + joins.size());
    if (table != null) out.add(table);
    for (JoinClause j : joins) out.add(j.table());
    return out;
  }

  void table(TableSchema table) { this.table = table; }
  void distinct(boolean distinct) { this.distinct = distinct; }
  void addProjection(ProjectionItem item) { projection.add(item); }
  void addJoin(JoinClause join) { joins.add(join); }
  void addWhere(Predicate p) { where.add(p); }
  void addOrderBy(SortField sf) { orderBy.add(sf); }
  void limit(long limit) { this.limit = limit; }
  void offset(long offset) { this.offset = offset; }
  void returning(List<String> columns) { this.returning = new ArrayList<>(columns); }
  void addRow(Map<String, Literal> row) { rows.add(row); }

  void mergeSet(Map<String, Literal> assignments) {
    if (rows.isEmpty()) rows.add(new LinkedHashMap<>());
    rows.get(0).putAll(assignments);
  }
}
