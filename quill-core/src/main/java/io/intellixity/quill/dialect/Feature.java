package io.intellixity.quill.dialect;

/** Clauses whose availability differs between dialects. */
public enum Feature {
  RETURNING("RETURNING"),
  ILIKE("ILIKE"),
  FULL_JOIN("FULL JOIN"),
  UPDATE_LIMIT("LIMIT on UPDATE"),
  DELETE_LIMIT("LIMIT on DELETE");

  private final String label;

  Feature(String label) {
    this.label = label;
  }

  /** SQL-facing name used in error messages. */
  public String label() {
    return label;
  }
}
