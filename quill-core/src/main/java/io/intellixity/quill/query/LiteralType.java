package io.intellixity.quill.query;

/** Closed set of value kinds a {@link Literal} can carry. */
public enum LiteralType {
  NULL,
  TEXT,
  INTEGER,
  FLOAT,
  BOOLEAN,
  STRUCTURED
}
