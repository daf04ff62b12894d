package io.intellixity.quill.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Driver-level result of one statement: column descriptors plus row tuples for row-producing statements,
 * or an update count for the rest (-1 when rows were produced).
 */
public record RawRows(List<RawColumn> columns, List<List<Object>> rows, long updateCount) {
  public RawRows {
    columns = columns == null ? List.of() : List.copyOf(columns);
    if (rows == null) {
      rows = List.of();
    } else {
      // rows may contain SQL NULLs, so List.copyOf is not an option
      List<List<Object>> copy = new ArrayList<>(rows.size());
      for (List<Object> r : rows) copy.add(Collections.unmodifiableList(new ArrayList<>(r)));
      rows = Collections.unmodifiableList(copy);
    }
  }

  public static RawRows of(List<RawColumn> columns, List<List<Object>> rows) {
    return new RawRows(columns, rows, -1);
  }

  public static RawRows updateCount(long count) {
    return new RawRows(List.of(), List.of(), count);
  }

  public int size() { return rows.size(); }
}
