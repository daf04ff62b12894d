package io.intellixity.quill.query;

/** Either side of a comparison: a column reference or a bound literal. */
public interface Operand {
}
