package io.intellixity.quill.errors;

/** Two result columns map to the same key while the strict collision policy is active. */
public final class AmbiguousColumnException extends QuillException {
  private final String key;

  public AmbiguousColumnException(String key) {
    super("Result column '" + key + "' is produced by more than one table; qualify or alias it");
    this.key = key;
  }

  public String key() { return key; }
}
