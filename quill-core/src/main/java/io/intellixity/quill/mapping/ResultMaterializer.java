package io.intellixity.quill.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.quill.compile.CompiledStatement;
import io.intellixity.quill.errors.AmbiguousColumnException;
import io.intellixity.quill.exec.RawColumn;
import io.intellixity.quill.exec.RawRows;
import io.intellixity.quill.query.ColumnRef;
import io.intellixity.quill.schema.ColumnDef;
import io.intellixity.quill.schema.SemanticType;
import io.intellixity.quill.schema.TableSchema;

import java.util.*;

/**
 * Turns {@link RawRows} into name -> value mappings, or into records via a {@link RecordHydrator}.
 * <p>
 * Result keys: the alias when the projection item was aliased, {@code table.column} when it was qualified,
 * otherwise the bare column name. Statements selecting {@code *} use the driver's column labels.
 * Values of STRUCTURED columns arrive as JSON text (the compiler binds everything written to them as JSON) and
 * are decoded into {@code Map}/{@code List} or the JSON scalar.
 */
public final class ResultMaterializer {
  private final ColumnCollisionPolicy collisionPolicy;
  private final ObjectMapper json;

  public ResultMaterializer() {
    this(ColumnCollisionPolicy.LAST_JOINED_WINS, new ObjectMapper());
  }

  public ResultMaterializer(ColumnCollisionPolicy collisionPolicy, ObjectMapper json) {
    this.collisionPolicy = Objects.requireNonNull(collisionPolicy, "collisionPolicy");
    this.json = Objects.requireNonNull(json, "json");
  }

  public ColumnCollisionPolicy collisionPolicy() { return collisionPolicy; }

  public List<Map<String, Object>> toMaps(CompiledStatement statement, RawRows raw) {
    Objects.requireNonNull(statement, "statement");
    Objects.requireNonNull(raw, "raw");
    if (raw.rows().isEmpty()) return List.of();

    int width = raw.columns().size();
    String[] keys = new String[width];
    boolean[] structured = new boolean[width];
    resolveColumns(statement, raw.columns(), keys, structured);

    Set<String> seen = new HashSet<>();
    for (String k : keys) {
      if (!seen.add(k) && collisionPolicy == ColumnCollisionPolicy.STRICT) throw new AmbiguousColumnException(k);
    }

    List<Map<String, Object>> out = new ArrayList<>(raw.rows().size());
    for (List<Object> row : raw.rows()) {
      Map<String, Object> m = new LinkedHashMap<>();
      for (int i = 0; i < width; i++) {
        Object v = i < row.size() ? row.get(i) : null;
        m.put(keys[i], structured[i] ? decodeJson(v) : v);
      }
      out.add(m);
    }
    return out;
  }

  public <T> List<T> toRecords(List<Map<String, Object>> rows, RecordHydrator<T> hydrator) {
    Objects.requireNonNull(rows, "rows");
    Objects.requireNonNull(hydrator, "hydrator");
    List<T> out = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) out.add(hydrator.populate(row));
    return out;
  }

  private static void resolveColumns(CompiledStatement s, List<RawColumn> columns, String[] keys, boolean[] structured) {
    List<ColumnRef> projection = s.projection();
    boolean byProjection = !projection.isEmpty() && projection.size() == columns.size();
    for (int i = 0; i < columns.size(); i++) {
      if (byProjection) {
        ColumnRef ref = projection.get(i);
        keys[i] = keyFor(ref);
        structured[i] = typeOf(s.tables(), ref.table(), ref.column()) == SemanticType.STRUCTURED;
      } else {
        RawColumn c = columns.get(i);
        keys[i] = c.label();
        structured[i] = typeOf(s.tables(), c.table(), c.label()) == SemanticType.STRUCTURED;
      }
    }
  }

  static String keyFor(ColumnRef ref) {
    if (ref.hasAlias()) return ref.alias();
    if (ref.isQualified()) return ref.table() + "." + ref.column();
    return ref.column();
  }

  /** Type of the column in the named table, or in the last table declaring it when the table is unknown. */
  private static SemanticType typeOf(List<TableSchema> tables, String table, String column) {
    if (table != null) {
      for (TableSchema t : tables) {
        if (t.name().equals(table)) return t.hasColumn(column) ? t.column(column).type() : null;
      }
    }
    SemanticType found = null;
    for (TableSchema t : tables) {
      if (t.hasColumn(column)) {
        ColumnDef c = t.column(column);
        found = c.type();
      }
    }
    return found;
  }

  private Object decodeJson(Object v) {
    if (!(v instanceof String s)) return v;
    try {
      return json.readValue(s, Object.class);
    } catch (JsonProcessingException e) {
      // not JSON, e.g. a row written outside Quill; keep the driver value
      return s;
    }
  }
}
