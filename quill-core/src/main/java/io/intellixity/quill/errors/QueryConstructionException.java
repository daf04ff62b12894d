package io.intellixity.quill.errors;

/**
 * Raised when a builder call is invalid for the statement being built (negative limit, empty payload,
 * clause after the statement was consumed, ...). Never reaches compilation.
 */
public final class QueryConstructionException extends QuillException {
  public QueryConstructionException(String message) {
    super(message);
  }
}
