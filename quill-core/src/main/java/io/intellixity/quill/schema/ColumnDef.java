package io.intellixity.quill.schema;

import java.util.Objects;

public record ColumnDef(String name, SemanticType type, boolean nullable, boolean primaryKey) {
  public ColumnDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) throw new IllegalArgumentException("column name must not be blank");
  }

  public static ColumnDef of(String name, SemanticType type, boolean nullable) {
    return new ColumnDef(name, type, nullable, false);
  }
}
