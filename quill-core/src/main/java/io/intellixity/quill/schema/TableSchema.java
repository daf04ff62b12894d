package io.intellixity.quill.schema;

import io.intellixity.quill.errors.UnknownColumnException;
import io.intellixity.quill.mapping.RecordHydrator;
import io.intellixity.quill.query.ColumnRef;

import java.util.*;

/**
 * Table descriptor consumed by the query core: table name and ordered column list.
 * <p>
 * Built by the caller (typically from an external model definition); the core never introspects a database.
 * An optional {@link RecordHydrator} turns result rows of this table into caller-defined records.
 */
public final class TableSchema {
  private final String name;
  private final List<ColumnDef> columns;
  private final Map<String, ColumnDef> byName;
  private final RecordHydrator<?> hydrator;

  private TableSchema(String name, List<ColumnDef> columns, RecordHydrator<?> hydrator) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("table name must not be blank");
    if (columns.isEmpty()) throw new IllegalArgumentException("table '" + name + "' declares no columns");
    Map<String, ColumnDef> m = new LinkedHashMap<>();
    for (ColumnDef c : columns) {
      if (m.putIfAbsent(c.name(), c) != null) {
        throw new IllegalArgumentException("Duplicate column '" + c.name() + "' in table '" + name + "'");
      }
    }
    this.columns = List.copyOf(columns);
    this.byName = Collections.unmodifiableMap(m);
    this.hydrator = hydrator;
  }

  public static Builder builder(String name) { return new Builder(name); }

  public String name() { return name; }
  /** Columns in declaration order. */
  public List<ColumnDef> columns() { return columns; }
  public Set<String> columnNames() { return byName.keySet(); }
  public boolean hasColumn(String column) { return byName.containsKey(column); }
  public Optional<RecordHydrator<?>> hydrator() { return Optional.ofNullable(hydrator); }

  public ColumnDef column(String column) {
    ColumnDef c = byName.get(column);
    if (c == null) throw new UnknownColumnException(name, column);
    return c;
  }

  /** Column reference for use in projections, predicates and ordering. */
  public ColumnRef col(String column) {
    column(column);
    return new ColumnRef(name, column);
  }

  /** Copy of this schema carrying the given record hydrator. */
  public TableSchema withHydrator(RecordHydrator<?> hydrator) {
    return new TableSchema(name, columns, Objects.requireNonNull(hydrator, "hydrator"));
  }

  @Override
  public String toString() {
    return "TableSchema[" + name + ", columns=" + byName.keySet() + "]";
  }

  public static final class Builder {
    private final String name;
    private final List<ColumnDef> columns = new ArrayList<>();
    private RecordHydrator<?> hydrator;

    private Builder(String name) {
      this.name = name;
    }

    public Builder column(ColumnDef column) {
      columns.add(Objects.requireNonNull(column, "column"));
      return this;
    }

    public Builder column(String column, SemanticType type, boolean nullable) {
      return column(ColumnDef.of(column, type, nullable));
    }

    public Builder primaryKey(String column, SemanticType type) {
      return column(new ColumnDef(column, type, false, true));
    }

    public Builder hydrator(RecordHydrator<?> hydrator) {
      this.hydrator = hydrator;
      return this;
    }

    public TableSchema build() {
      return new TableSchema(name, columns, hydrator);
    }
  }
}
