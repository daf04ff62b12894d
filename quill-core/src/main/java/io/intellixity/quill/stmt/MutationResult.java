package io.intellixity.quill.stmt;

import java.util.List;
import java.util.Map;

/**
 * Outcome of an insert/update/delete. With RETURNING, {@code returning} holds the returned rows and
 * {@code affectedRows} is their count; otherwise {@code returning} is empty and the count comes from the driver.
 */
public record MutationResult(long affectedRows, List<Map<String, Object>> returning) {
  public MutationResult {
    returning = returning == null ? List.of() : List.copyOf(returning);
  }
}
