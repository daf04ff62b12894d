package io.intellixity.quill.dialect;

import java.util.List;

/** Built-in capability table. */
public final class Dialects {
  private Dialects() {}

  public static final Dialect POSTGRES = Dialect.builder("postgres")
      .quotes("\"", "\"")
      .placeholders(PlaceholderStyle.NUMBERED)
      .supports(Feature.RETURNING, Feature.ILIKE, Feature.FULL_JOIN)
      .build();

  public static final Dialect MYSQL = Dialect.builder("mysql")
      .quotes("`", "`")
      .placeholders(PlaceholderStyle.QUESTION_MARK)
      .supports(Feature.UPDATE_LIMIT, Feature.DELETE_LIMIT)
      // OFFSET requires a LIMIT; the maximum unsigned BIGINT means "all rows"
      .unboundedLimit("18446744073709551615")
      .build();

  // RETURNING since 3.35, FULL JOIN since 3.39; LIMIT on UPDATE/DELETE needs a non-default compile option.
  // OFFSET requires a LIMIT, hence the unbounded one.
  public static final Dialect SQLITE = Dialect.builder("sqlite")
      .quotes("\"", "\"")
      .placeholders(PlaceholderStyle.QUESTION_MARK)
      .supports(Feature.RETURNING, Feature.FULL_JOIN)
      .unboundedLimit("-1")
      .build();

  public static List<Dialect> builtIns() {
    return List.of(POSTGRES, MYSQL, SQLITE);
  }
}
