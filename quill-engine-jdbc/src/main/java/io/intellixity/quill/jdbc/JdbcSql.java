package io.intellixity.quill.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiled SQL rewritten into JDBC form ('?' placeholders).
 * <p>
 * {@code paramOrder.get(i)} is the 0-based index into the statement's parameters that JDBC position {@code i + 1}
 * binds. Numbered placeholders ({@code $n}) map to {@code n - 1}; '?' placeholders map to their appearance order.
 */
public record JdbcSql(String sql, List<Integer> paramOrder) {
  public JdbcSql {
    paramOrder = List.copyOf(paramOrder);
  }

  /**
   * Purely lexical scanning. Placeholders inside single-quoted strings, double-quoted or backtick-quoted
   * identifiers are left alone.
   */
  public static JdbcSql rewrite(String sql) {
    if (sql == null) return new JdbcSql("", List.of());
    StringBuilder out = new StringBuilder(sql.length());
    List<Integer> order = new ArrayList<>();
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) {
          // doubled quote is an escape
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"' || ch == '`') {
        quote = ch;
        out.append(ch);
        continue;
      }

      if (ch == '$' && i + 1 < sql.length() && isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && isDigit(sql.charAt(end))) end++;
        int n = Integer.parseInt(sql.substring(i + 1, end));
        if (n <= 0) throw new IllegalArgumentException("Invalid placeholder $" + n + " in: " + sql);
        order.add(n - 1);
        out.append('?');
        i = end - 1;
        continue;
      }

      if (ch == '?') order.add(order.size());
      out.append(ch);
    }

    return new JdbcSql(out.toString(), order);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
