package io.intellixity.quill.spi.bind;

import io.intellixity.quill.query.Literal;

/**
 * Applies one literal parameter to a native target (e.g. a JDBC {@code PreparedStatement}).
 * <p>
 * {@code value} is {@code literal.value()} already narrowed to {@link #valueType()}; it is null for NULL literals.
 */
public interface Binder<TTarget, TValue> {
  Class<TTarget> targetType();

  Class<TValue> valueType();

  boolean supports(BindContext ctx, Literal literal, TValue value);

  void bind(TTarget target, BindContext ctx, Literal literal, TValue value);
}
