package io.intellixity.quill.query;

import io.intellixity.quill.errors.QueryConstructionException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Typed value destined for parameter binding. Literals are never interpolated into SQL text.
 * <p>
 * Java values are classified once, at the API boundary, into the closed {@link LiteralType} set:
 * <ul>
 *   <li>{@code null} -> NULL</li>
 *   <li>{@link CharSequence}, enum constants -> TEXT (enums by name)</li>
 *   <li>{@code Byte/Short/Integer/Long/BigInteger} -> INTEGER</li>
 *   <li>{@code Float/Double/BigDecimal} -> FLOAT</li>
 *   <li>{@link Boolean} -> BOOLEAN</li>
 *   <li>{@link Map}, {@link List} -> STRUCTURED</li>
 * </ul>
 * Anything else is rejected.
 */
public final class Literal implements Operand {
  public static final Literal NULL = new Literal(LiteralType.NULL, null);

  private final LiteralType type;
  private final Object value;

  private Literal(LiteralType type, Object value) {
    this.type = type;
    this.value = value;
  }

  public LiteralType type() { return type; }
  public Object value() { return value; }
  public boolean isNull() { return type == LiteralType.NULL; }

  public static Literal of(Object value) {
    if (value == null) return NULL;
    if (value instanceof Literal l) return l;
    if (value instanceof CharSequence cs) return new Literal(LiteralType.TEXT, cs.toString());
    if (value instanceof Enum<?> e) return new Literal(LiteralType.TEXT, e.name());
    if (value instanceof Boolean) return new Literal(LiteralType.BOOLEAN, value);
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte || value instanceof BigInteger) {
      return new Literal(LiteralType.INTEGER, value);
    }
    if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
      return new Literal(LiteralType.FLOAT, value);
    }
    if (value instanceof Map<?, ?> m) {
      return new Literal(LiteralType.STRUCTURED, Collections.unmodifiableMap(new LinkedHashMap<>(m)));
    }
    if (value instanceof List<?> l) {
      return new Literal(LiteralType.STRUCTURED, Collections.unmodifiableList(new ArrayList<>(l)));
    }
    throw new QueryConstructionException("Unsupported literal value type: " + value.getClass().getName());
  }

  /**
   * STRUCTURED literal for any JSON value, bare scalars included, so that {@code "42"} is stored as the JSON
   * string {@code "42"} rather than the number. Null stays {@link #NULL}.
   */
  public static Literal structured(Object value) {
    Literal l = of(value);
    if (l.type == LiteralType.NULL || l.type == LiteralType.STRUCTURED) return l;
    return new Literal(LiteralType.STRUCTURED, l.value);
  }

  public static Literal text(String value) { return value == null ? NULL : new Literal(LiteralType.TEXT, value); }
  public static Literal integer(long value) { return new Literal(LiteralType.INTEGER, value); }
  public static Literal floating(double value) { return new Literal(LiteralType.FLOAT, value); }
  public static Literal bool(boolean value) { return new Literal(LiteralType.BOOLEAN, value); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Literal other)) return false;
    return type == other.type && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    return type + "(" + value + ")";
  }
}
