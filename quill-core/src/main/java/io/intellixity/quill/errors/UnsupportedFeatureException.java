package io.intellixity.quill.errors;

import io.intellixity.quill.dialect.Feature;

/** The target dialect lacks a clause the statement requested. Raised before any SQL text is produced. */
public final class UnsupportedFeatureException extends QuillException {
  private final Feature feature;
  private final String dialectId;

  public UnsupportedFeatureException(Feature feature, String dialectId) {
    super(feature.label() + " is not supported by dialect: " + dialectId);
    this.feature = feature;
    this.dialectId = dialectId;
  }

  public Feature feature() { return feature; }
  public String dialectId() { return dialectId; }
}
