package io.intellixity.quill.dialect;

public enum PlaceholderStyle {
  /** {@code $1, $2, ...} */
  NUMBERED {
    @Override public String placeholder(int position1Based) { return "$" + position1Based; }
  },
  /** {@code ?} for every parameter. */
  QUESTION_MARK {
    @Override public String placeholder(int position1Based) { return "?"; }
  };

  public abstract String placeholder(int position1Based);
}
