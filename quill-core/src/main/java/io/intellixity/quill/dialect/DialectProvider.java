package io.intellixity.quill.dialect;

import java.util.Collection;

/** Contributes additional dialects; discovered via {@code META-INF/quill.factories}. */
public interface DialectProvider {
  Collection<Dialect> dialects();
}
