package io.intellixity.quill.schema;

/** Semantic type tag of a column, as supplied by the schema descriptor. */
public enum SemanticType {
  TEXT,
  INTEGER,
  FLOAT,
  BOOLEAN,
  /** JSON-like map/list/scalar document. */
  STRUCTURED,
  /** Integer key referencing another table. */
  FOREIGN_KEY
}
