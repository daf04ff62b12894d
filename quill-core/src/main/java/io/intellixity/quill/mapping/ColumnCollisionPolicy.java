package io.intellixity.quill.mapping;

/** What to do when two result columns map to the same key. */
public enum ColumnCollisionPolicy {
  /** The later column overwrites the earlier one; with joins that is the last joined table's column. */
  LAST_JOINED_WINS,
  /** Fail with {@link io.intellixity.quill.errors.AmbiguousColumnException}. */
  STRICT
}
