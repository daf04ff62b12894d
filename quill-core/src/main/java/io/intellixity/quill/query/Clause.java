package io.intellixity.quill.query;

public enum Clause {
  AND,
  OR
}
