package io.intellixity.quill.exec;

import java.util.Objects;

/** Result column as reported by the driver. {@code table} may be null when the driver does not know it. */
public record RawColumn(String table, String label) {
  public RawColumn {
    Objects.requireNonNull(label, "label");
    if (table != null && table.isBlank()) table = null;
  }
}
