package io.intellixity.quill.query;

import java.util.Objects;

public record SortField(ColumnRef column, Direction direction) {
  public SortField {
    Objects.requireNonNull(column, "column");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction { ASC, DESC }
}
