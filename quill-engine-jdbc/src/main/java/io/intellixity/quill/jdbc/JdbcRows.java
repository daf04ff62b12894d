package io.intellixity.quill.jdbc;

import io.intellixity.quill.exec.RawColumn;
import io.intellixity.quill.exec.RawRows;

import java.sql.*;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Drains a {@link ResultSet} into {@link RawRows}. */
final class JdbcRows {
  private JdbcRows() {}

  static RawRows read(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<RawColumn> columns = new ArrayList<>(n);
    boolean[] jsonText = new boolean[n];
    for (int i = 1; i <= n; i++) {
      columns.add(new RawColumn(md.getTableName(i), md.getColumnLabel(i)));
      String typeName = md.getColumnTypeName(i);
      jsonText[i - 1] = typeName != null && typeName.toLowerCase(Locale.ROOT).startsWith("json");
    }

    List<List<Object>> rows = new ArrayList<>();
    while (rs.next()) {
      List<Object> row = new ArrayList<>(n);
      for (int i = 1; i <= n; i++) {
        // json/jsonb come back as driver objects (e.g. PGobject); the materializer decodes the text
        row.add(jsonText[i - 1] ? rs.getString(i) : value(rs.getObject(i)));
      }
      rows.add(row);
    }
    return RawRows.of(columns, rows);
  }

  private static Object value(Object v) throws SQLException {
    if (v instanceof java.sql.Array a) {
      Object arr = a.getArray();
      if (arr instanceof Object[] oa) return Arrays.asList(oa);
      return arr;
    }
    return v;
  }
}
