package io.intellixity.quill.compile;

import io.intellixity.quill.compile.CompiledStatement.ExecKind;
import io.intellixity.quill.dialect.Dialect;
import io.intellixity.quill.dialect.Feature;
import io.intellixity.quill.errors.InconsistentColumnsException;
import io.intellixity.quill.errors.QueryConstructionException;
import io.intellixity.quill.errors.UnknownColumnException;
import io.intellixity.quill.errors.UnsupportedFeatureException;
import io.intellixity.quill.query.*;
import io.intellixity.quill.schema.SemanticType;
import io.intellixity.quill.schema.TableSchema;
import io.intellixity.quill.stmt.*;

import java.util.*;

/**
 * Renders a {@link StatementState} into dialect SQL plus ordered parameters.
 * <p>
 * Compilation is all-or-nothing and side-effect free: every check (capabilities, row shapes, column names)
 * runs before any text is rendered, and the state is only read. Compiling the same state twice yields identical
 * output.
 * <p>
 * Clause order is fixed: SELECT [DISTINCT] projection, FROM, JOINs, WHERE, ORDER BY, LIMIT, OFFSET; DML renders
 * WHERE, LIMIT and RETURNING in that order. Column references are qualified ({@code "t"."c"}) when the caller
 * asked for it or whenever the statement has joins.
 */
public final class SqlCompiler {
  private static final class RenderCtx {
    private final Dialect dialect;
    private final boolean qualifyAll;
    private final List<Literal> binds = new ArrayList<>();

    private RenderCtx(Dialect dialect, boolean qualifyAll) {
      this.dialect = dialect;
      this.qualifyAll = qualifyAll;
    }

    String add(Literal l) {
      binds.add(l);
      return dialect.placeholder(binds.size());
    }
  }

  public CompiledStatement compile(StatementState state, Dialect dialect) {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(dialect, "dialect");
    if (state.table() == null) throw new QueryConstructionException("No table selected");

    checkCapabilities(state, dialect);
    checkColumns(state);

    RenderCtx ctx = new RenderCtx(dialect, !state.joins().isEmpty());
    return switch (state.kind()) {
      case SELECT -> renderSelect(state, ctx);
      case INSERT -> renderInsert(state, ctx);
      case UPDATE -> renderUpdate(state, ctx);
      case DELETE -> renderDelete(state, ctx);
    };
  }

  // ---- pre-flight ----

  private static void checkCapabilities(StatementState state, Dialect dialect) {
    if (state.returning() != null) require(dialect, Feature.RETURNING);
    for (JoinClause j : state.joins()) {
      if (j.kind() == JoinKind.FULL) require(dialect, Feature.FULL_JOIN);
    }
    if (state.limit() != null) {
      if (state.kind() == StatementKind.UPDATE) require(dialect, Feature.UPDATE_LIMIT);
      if (state.kind() == StatementKind.DELETE) require(dialect, Feature.DELETE_LIMIT);
    }
    if (!dialect.supportsIlike()) {
      boolean ilike = false;
      for (JoinClause j : state.joins()) ilike |= j.on().accept(ILIKE_FINDER);
      for (Predicate p : state.where()) ilike |= p.accept(ILIKE_FINDER);
      if (ilike) throw new UnsupportedFeatureException(Feature.ILIKE, dialect.id());
    }
  }

  private static void require(Dialect dialect, Feature feature) {
    if (!dialect.supports(feature)) throw new UnsupportedFeatureException(feature, dialect.id());
  }

  private static final PredicateVisitor<Boolean> ILIKE_FINDER = new PredicateVisitor<>() {
    @Override public Boolean visit(Comparison comparison) { return false; }
    @Override public Boolean visit(PatternMatch pattern) { return !pattern.caseSensitive(); }
    @Override public Boolean visit(NullCheck nullCheck) { return false; }
    @Override public Boolean visit(Membership membership) { return false; }
    @Override public Boolean visit(Range range) { return false; }

    @Override
    public Boolean visit(LogicalGroup group) {
      for (Predicate p : group.elements()) {
        if (p.accept(this)) return true;
      }
      return false;
    }
  };

  private static void checkColumns(StatementState state) {
    TableSchema base = state.table();
    // a join's ON clause sees the base table and the tables joined so far, itself included
    Map<String, TableSchema> scope = new LinkedHashMap<>();
    scope.put(base.name(), base);
    for (JoinClause j : state.joins()) {
      scope.put(j.table().name(), j.table());
      checkPredicateColumns(scope, j.on());
    }

    for (ProjectionItem item : state.projection()) {
      String table = item.table() == null ? base.name() : item.table();
      checkColumn(scope, table, item.column());
    }
    for (Predicate p : state.where()) checkPredicateColumns(scope, p);
    for (SortField sf : state.orderBy()) checkColumn(scope, sf.column().table(), sf.column().column());
    if (state.returning() != null) {
      for (String c : state.returning()) base.column(c);
    }

    if (state.kind() == StatementKind.INSERT) checkInsertRows(state);
    if (state.kind() == StatementKind.UPDATE && (state.rows().isEmpty() || state.rows().get(0).isEmpty())) {
      throw new QueryConstructionException("No values specified for UPDATE; use set()");
    }
    for (Map<String, Literal> row : state.rows()) {
      for (String c : row.keySet()) base.column(c);
    }
  }

  private static void checkInsertRows(StatementState state) {
    List<Map<String, Literal>> rows = state.rows();
    if (rows.isEmpty()) throw new QueryConstructionException("No values specified for INSERT");
    Set<String> expected = rows.get(0).keySet();
    for (int i = 1; i < rows.size(); i++) {
      Set<String> actual = rows.get(i).keySet();
      if (!expected.equals(actual)) throw new InconsistentColumnsException(i, expected, actual);
    }
  }

  private static void checkColumn(Map<String, TableSchema> scope, String table, String column) {
    TableSchema t = scope.get(table);
    if (t == null) {
      throw new QueryConstructionException("Table '" + table + "' is not part of this statement (column '" + column + "')");
    }
    if (!t.hasColumn(column)) throw new UnknownColumnException(table, column);
  }

  private static void checkPredicateColumns(Map<String, TableSchema> scope, Predicate p) {
    p.accept(new PredicateVisitor<Void>() {
      @Override
      public Void visit(Comparison c) {
        operand(c.left());
        operand(c.right());
        return null;
      }

      @Override public Void visit(PatternMatch pm) { return col(pm.column()); }
      @Override public Void visit(NullCheck nc) { return col(nc.column()); }
      @Override public Void visit(Membership m) { return col(m.column()); }
      @Override public Void visit(Range r) { return col(r.column()); }

      @Override
      public Void visit(LogicalGroup g) {
        for (Predicate child : g.elements()) child.accept(this);
        return null;
      }

      private void operand(Operand o) {
        if (o instanceof ColumnRef ref) col(ref);
      }

      private Void col(ColumnRef ref) {
        checkColumn(scope, ref.table(), ref.column());
        return null;
      }
    });
  }

  // ---- rendering ----

  private CompiledStatement renderSelect(StatementState state, RenderCtx ctx) {
    TableSchema base = state.table();
    StringBuilder sql = new StringBuilder("SELECT ");
    if (state.distinct()) sql.append("DISTINCT ");

    List<ColumnRef> projection = new ArrayList<>();
    if (state.projection().isEmpty()) {
      sql.append('*');
    } else {
      List<String> items = new ArrayList<>();
      for (ProjectionItem item : state.projection()) {
        ColumnRef ref = item.resolve(base.name());
        projection.add(ref);
        String expr = columnSql(ref, ctx);
        items.add(ref.hasAlias() ? expr + " AS " + ctx.dialect.quoteIdent(ref.alias()) : expr);
      }
      sql.append(String.join(", ", items));
    }

    sql.append(" FROM ").append(ctx.dialect.quoteIdent(base.name()));
    for (JoinClause j : state.joins()) {
      sql.append(' ').append(j.kind().sql()).append(' ').append(ctx.dialect.quoteIdent(j.table().name()))
          .append(" ON ").append(predicateSql(j.on(), ctx));
    }
    appendWhere(sql, state, ctx);

    if (!state.orderBy().isEmpty()) {
      List<String> parts = new ArrayList<>();
      for (SortField sf : state.orderBy()) {
        parts.add(columnSql(sf.column(), ctx) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
      }
      sql.append(" ORDER BY ").append(String.join(", ", parts));
    }
    if (state.limit() != null) {
      sql.append(" LIMIT ").append(state.limit());
    } else if (state.offset() != null && ctx.dialect.unboundedLimit() != null) {
      sql.append(" LIMIT ").append(ctx.dialect.unboundedLimit());
    }
    if (state.offset() != null) sql.append(" OFFSET ").append(state.offset());

    return new CompiledStatement(sql.toString(), ctx.binds, ExecKind.QUERY, StatementKind.SELECT,
        projection, state.tables());
  }

  private CompiledStatement renderInsert(StatementState state, RenderCtx ctx) {
    TableSchema base = state.table();
    List<Map<String, Literal>> rows = state.rows();
    List<String> columns = new ArrayList<>(rows.get(0).keySet());

    List<String> quoted = new ArrayList<>(columns.size());
    for (String c : columns) quoted.add(ctx.dialect.quoteIdent(c));

    List<String> tuples = new ArrayList<>(rows.size());
    for (Map<String, Literal> row : rows) {
      List<String> ph = new ArrayList<>(columns.size());
      for (String c : columns) ph.add(ctx.add(columnValue(base, c, row.get(c))));
      tuples.add("(" + String.join(", ", ph) + ")");
    }

    StringBuilder sql = new StringBuilder("INSERT INTO ").append(ctx.dialect.quoteIdent(base.name()))
        .append(" (").append(String.join(", ", quoted)).append(") VALUES ").append(String.join(", ", tuples));
    return finishDml(sql, state, ctx);
  }

  private CompiledStatement renderUpdate(StatementState state, RenderCtx ctx) {
    TableSchema base = state.table();
    List<String> sets = new ArrayList<>();
    for (Map.Entry<String, Literal> e : state.rows().get(0).entrySet()) {
      sets.add(ctx.dialect.quoteIdent(e.getKey()) + " = " + ctx.add(columnValue(base, e.getKey(), e.getValue())));
    }
    StringBuilder sql = new StringBuilder("UPDATE ").append(ctx.dialect.quoteIdent(base.name()))
        .append(" SET ").append(String.join(", ", sets));
    appendWhere(sql, state, ctx);
    if (state.limit() != null) sql.append(" LIMIT ").append(state.limit());
    return finishDml(sql, state, ctx);
  }

  private CompiledStatement renderDelete(StatementState state, RenderCtx ctx) {
    StringBuilder sql = new StringBuilder("DELETE FROM ").append(ctx.dialect.quoteIdent(state.table().name()));
    appendWhere(sql, state, ctx);
    if (state.limit() != null) sql.append(" LIMIT ").append(state.limit());
    return finishDml(sql, state, ctx);
  }

  /** Values written to STRUCTURED columns are always bound as JSON, whatever Java type the caller passed. */
  private static Literal columnValue(TableSchema table, String column, Literal value) {
    if (table.column(column).type() != SemanticType.STRUCTURED) return value;
    return Literal.structured(value.value());
  }

  private static CompiledStatement finishDml(StringBuilder sql, StatementState state, RenderCtx ctx) {
    List<String> returning = state.returning();
    List<ColumnRef> projection = new ArrayList<>();
    if (returning != null) {
      if (returning.isEmpty()) {
        sql.append(" RETURNING *");
      } else {
        List<String> cols = new ArrayList<>(returning.size());
        for (String c : returning) {
          cols.add(ctx.dialect.quoteIdent(c));
          projection.add(new ColumnRef(state.table().name(), c));
        }
        sql.append(" RETURNING ").append(String.join(", ", cols));
      }
    }
    ExecKind execKind = returning == null ? ExecKind.UPDATE : ExecKind.QUERY;
    return new CompiledStatement(sql.toString(), ctx.binds, execKind, state.kind(), projection, state.tables());
  }

  private void appendWhere(StringBuilder sql, StatementState state, RenderCtx ctx) {
    List<Predicate> where = state.where();
    if (where.isEmpty()) return;
    Predicate root = where.size() == 1 ? where.get(0) : new LogicalGroup(Clause.AND, where);
    sql.append(" WHERE ").append(predicateSql(root, ctx));
  }

  private static String columnSql(ColumnRef ref, RenderCtx ctx) {
    String col = ctx.dialect.quoteIdent(ref.column());
    if (ref.isQualified() || ctx.qualifyAll) return ctx.dialect.quoteIdent(ref.table()) + "." + col;
    return col;
  }

  private static String operandSql(Operand o, RenderCtx ctx) {
    if (o instanceof ColumnRef ref) return columnSql(ref, ctx);
    if (o instanceof Literal l) return ctx.add(l);
    throw new IllegalArgumentException("Unsupported operand: " + o.getClass().getName());
  }

  private static String predicateSql(Predicate p, RenderCtx ctx) {
    return p.accept(new PredicateVisitor<String>() {
      @Override
      public String visit(Comparison c) {
        String left = operandSql(c.left(), ctx);
        return left + " " + c.operator().sql() + " " + operandSql(c.right(), ctx);
      }

      @Override
      public String visit(PatternMatch pm) {
        return columnSql(pm.column(), ctx) + (pm.caseSensitive() ? " LIKE " : " ILIKE ") + ctx.add(pm.pattern());
      }

      @Override
      public String visit(NullCheck nc) {
        return columnSql(nc.column(), ctx) + (nc.isNull() ? " IS NULL" : " IS NOT NULL");
      }

      @Override
      public String visit(Membership m) {
        if (m.isEmpty()) return m.negated() ? "TRUE" : "FALSE";
        String expr = columnSql(m.column(), ctx);
        List<String> ph = new ArrayList<>(m.values().size());
        for (Literal l : m.values()) ph.add(ctx.add(l));
        return expr + (m.negated() ? " NOT IN (" : " IN (") + String.join(", ", ph) + ")";
      }

      @Override
      public String visit(Range r) {
        String expr = columnSql(r.column(), ctx);
        String lo = ctx.add(r.low());
        return expr + " BETWEEN " + lo + " AND " + ctx.add(r.high());
      }

      @Override
      public String visit(LogicalGroup g) {
        List<String> parts = new ArrayList<>(g.elements().size());
        for (Predicate child : g.elements()) parts.add("(" + child.accept(this) + ")");
        return String.join(g.clause() == Clause.OR ? " OR " : " AND ", parts);
      }
    });
  }
}
