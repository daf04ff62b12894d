package io.intellixity.quill;

import io.intellixity.quill.schema.SemanticType;
import io.intellixity.quill.schema.TableSchema;

public final class TestTables {
  private TestTables() {}

  public static final TableSchema USERS = TableSchema.builder("users")
      .primaryKey("id", SemanticType.INTEGER)
      .column("name", SemanticType.TEXT, false)
      .column("age", SemanticType.INTEGER, true)
      .column("status", SemanticType.TEXT, true)
      .column("score", SemanticType.FLOAT, true)
      .column("active", SemanticType.BOOLEAN, true)
      .column("profile", SemanticType.STRUCTURED, true)
      .build();

  public static final TableSchema PETS = TableSchema.builder("pets")
      .primaryKey("id", SemanticType.INTEGER)
      .column("name", SemanticType.TEXT, false)
      .column("owner_id", SemanticType.FOREIGN_KEY, false)
      .build();
}
