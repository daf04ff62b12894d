package io.intellixity.quill.dialect;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only syntax/feature profile of one SQL backend.
 * <p>
 * A dialect is a plain value handed to the compiler on every call; there is no process-wide current dialect,
 * so several dialects can be used side by side.
 */
public final class Dialect {
  private final String id;
  private final String quoteOpen;
  private final String quoteClose;
  private final PlaceholderStyle placeholderStyle;
  private final Set<Feature> features;
  private final String unboundedLimit;

  private Dialect(Builder b) {
    this.id = Objects.requireNonNull(b.id, "id");
    this.quoteOpen = Objects.requireNonNull(b.quoteOpen, "quoteOpen");
    this.quoteClose = Objects.requireNonNull(b.quoteClose, "quoteClose");
    this.placeholderStyle = Objects.requireNonNull(b.placeholderStyle, "placeholderStyle");
    this.features = b.features.isEmpty() ? Set.of() : Set.copyOf(b.features);
    this.unboundedLimit = b.unboundedLimit;
  }

  public static Builder builder(String id) { return new Builder(id); }

  public String id() { return id; }
  public String quoteOpen() { return quoteOpen; }
  public String quoteClose() { return quoteClose; }
  public PlaceholderStyle placeholderStyle() { return placeholderStyle; }
  public Set<Feature> features() { return features; }

  /**
   * LIMIT value meaning "no limit", rendered in front of an OFFSET that has no LIMIT of its own.
   * Null when the dialect accepts a bare OFFSET.
   */
  public String unboundedLimit() { return unboundedLimit; }

  public boolean supports(Feature feature) { return features.contains(feature); }
  public boolean supportsReturning() { return supports(Feature.RETURNING); }
  public boolean supportsIlike() { return supports(Feature.ILIKE); }
  public boolean supportsFullJoin() { return supports(Feature.FULL_JOIN); }
  public boolean supportsUpdateLimit() { return supports(Feature.UPDATE_LIMIT); }
  public boolean supportsDeleteLimit() { return supports(Feature.DELETE_LIMIT); }

  /** Quote an identifier, doubling any embedded closing quote character. */
  public String quoteIdent(String ident) {
    Objects.requireNonNull(ident, "ident");
    return quoteOpen + ident.replace(quoteClose, quoteClose + quoteClose) + quoteClose;
  }

  public String placeholder(int position1Based) {
    return placeholderStyle.placeholder(position1Based);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Dialect d)) return false;
    return id.equals(d.id) && quoteOpen.equals(d.quoteOpen) && quoteClose.equals(d.quoteClose)
        && placeholderStyle == d.placeholderStyle && features.equals(d.features)
        && Objects.equals(unboundedLimit, d.unboundedLimit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, quoteOpen, quoteClose, placeholderStyle, features, unboundedLimit);
  }

  @Override
  public String toString() {
    return "Dialect[" + id + ", placeholders=" + placeholderStyle + ", features=" + features + "]";
  }

  public static final class Builder {
    private final String id;
    private String quoteOpen = "\"";
    private String quoteClose = "\"";
    private PlaceholderStyle placeholderStyle = PlaceholderStyle.QUESTION_MARK;
    private final Set<Feature> features = EnumSet.noneOf(Feature.class);
    private String unboundedLimit;

    private Builder(String id) {
      this.id = id;
    }

    public Builder quotes(String open, String close) {
      this.quoteOpen = open;
      this.quoteClose = close;
      return this;
    }

    public Builder placeholders(PlaceholderStyle style) {
      this.placeholderStyle = style;
      return this;
    }

    public Builder supports(Feature... features) {
      for (Feature f : features) this.features.add(Objects.requireNonNull(f, "feature"));
      return this;
    }

    public Builder unboundedLimit(String value) {
      this.unboundedLimit = value;
      return this;
    }

    public Dialect build() {
      return new Dialect(this);
    }
  }
}
