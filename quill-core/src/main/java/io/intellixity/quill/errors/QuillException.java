package io.intellixity.quill.errors;

/** Base type for every error raised by query construction, compilation, validation and dispatch. */
public abstract class QuillException extends RuntimeException {
  protected QuillException(String message) {
    super(message);
  }

  protected QuillException(String message, Throwable cause) {
    super(message, cause);
  }
}
