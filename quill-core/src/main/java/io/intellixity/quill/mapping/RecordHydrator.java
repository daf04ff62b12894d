package io.intellixity.quill.mapping;

import java.util.Map;

/** Builds a caller-defined record from one materialized row (result key -> value). */
@FunctionalInterface
public interface RecordHydrator<T> {
  T populate(Map<String, Object> row);
}
