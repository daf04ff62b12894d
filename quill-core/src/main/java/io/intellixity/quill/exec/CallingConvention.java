package io.intellixity.quill.exec;

public enum CallingConvention {
  /** Caller thread waits for the result. */
  BLOCKING,
  /** Caller receives a future; work happens elsewhere. */
  NON_BLOCKING
}
