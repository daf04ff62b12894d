package io.intellixity.quill.spi.bind;

import io.intellixity.quill.stmt.StatementKind;

/** Where a value is being bound. Backends extend this with their own positional details. */
public interface BindContext {
  StatementKind statementKind();
}
