package io.intellixity.quill.query;

public enum ComparisonOperator {
  EQ("="),
  NE("<>"),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">=");

  private final String sql;

  ComparisonOperator(String sql) {
    this.sql = sql;
  }

  public String sql() {
    return sql;
  }
}
