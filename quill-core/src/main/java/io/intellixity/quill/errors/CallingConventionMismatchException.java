package io.intellixity.quill.errors;

import io.intellixity.quill.exec.CallingConvention;

/** Blocking call against a non-blocking collaborator, or the reverse. No database work is performed. */
public final class CallingConventionMismatchException extends QuillException {
  private final CallingConvention requested;
  private final CallingConvention actual;

  public CallingConventionMismatchException(CallingConvention requested, CallingConvention actual) {
    super("Cannot use " + requested + " execution with a " + actual + " collaborator");
    this.requested = requested;
    this.actual = actual;
  }

  public CallingConvention requested() { return requested; }
  public CallingConvention actual() { return actual; }
}
