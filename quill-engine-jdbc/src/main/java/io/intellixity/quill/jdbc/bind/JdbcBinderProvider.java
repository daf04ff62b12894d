package io.intellixity.quill.jdbc.bind;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.quill.jdbc.JdbcExecutionException;
import io.intellixity.quill.query.Literal;
import io.intellixity.quill.query.LiteralType;
import io.intellixity.quill.spi.bind.BindContext;
import io.intellixity.quill.spi.bind.Binder;
import io.intellixity.quill.spi.bind.BinderProvider;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * JDBC-family binder base.
 * <p>
 * Dialect providers (e.g. postgres) extend this and add dialect binders, which are evaluated before the base
 * JDBC binders.
 */
public abstract class JdbcBinderProvider implements BinderProvider {
  static final ObjectMapper JSON = new ObjectMapper();

  @Override
  public final Collection<Binder<?, ?>> binders() {
    List<Binder<?, ?>> out = new ArrayList<>();
    out.addAll(dialectBinders());
    out.addAll(jdbcBinders());
    return List.copyOf(out);
  }

  /** Dialect-specific binders (default empty). Put overriding binders here. */
  protected Collection<Binder<?, ?>> dialectBinders() {
    return Collections.emptyList();
  }

  /** Base JDBC binders shared by all JDBC dialects. */
  protected Collection<Binder<?, ?>> jdbcBinders() {
    return List.of(
        new JdbcNullBinder(),
        new JdbcBigIntegerBinder(),
        new JdbcStructuredAsJsonTextBinder(),
        new JdbcSetObjectBinder()
    );
  }

  /** Position of the parameter being bound; every JDBC binder needs it. */
  protected static int position(BindContext ctx) {
    if (!(ctx instanceof JdbcBindContext jc)) throw new IllegalArgumentException("Expected JdbcBindContext");
    return jc.position1Based();
  }

  /** Encode a STRUCTURED literal value as JSON text. */
  protected static String jsonText(Object value) {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode structured value as JSON", e);
    }
  }

  static final class JdbcNullBinder implements Binder<PreparedStatement, Object> {
    @Override public Class<PreparedStatement> targetType() { return PreparedStatement.class; }
    @Override public Class<Object> valueType() { return Object.class; }

    @Override
    public boolean supports(BindContext ctx, Literal literal, Object value) {
      return literal.type() == LiteralType.NULL;
    }

    @Override
    public void bind(PreparedStatement ps, BindContext ctx, Literal literal, Object value) {
      int pos = position(ctx);
      try {
        ps.setNull(pos, Types.NULL);
      } catch (SQLException e) {
        throw new JdbcExecutionException("bind", e);
      }
    }
  }

  /** Not every driver accepts BigInteger through setObject; NUMERIC via BigDecimal is portable. */
  static final class JdbcBigIntegerBinder implements Binder<PreparedStatement, BigInteger> {
    @Override public Class<PreparedStatement> targetType() { return PreparedStatement.class; }
    @Override public Class<BigInteger> valueType() { return BigInteger.class; }

    @Override
    public boolean supports(BindContext ctx, Literal literal, BigInteger value) {
      return literal.type() == LiteralType.INTEGER;
    }

    @Override
    public void bind(PreparedStatement ps, BindContext ctx, Literal literal, BigInteger value) {
      int pos = position(ctx);
      try {
        ps.setBigDecimal(pos, new BigDecimal(value));
      } catch (SQLException e) {
        throw new JdbcExecutionException("bind", e);
      }
    }
  }

  /** Maps and lists are stored as JSON text unless a dialect binder knows a native JSON type. */
  static final class JdbcStructuredAsJsonTextBinder implements Binder<PreparedStatement, Object> {
    @Override public Class<PreparedStatement> targetType() { return PreparedStatement.class; }
    @Override public Class<Object> valueType() { return Object.class; }

    @Override
    public boolean supports(BindContext ctx, Literal literal, Object value) {
      return literal.type() == LiteralType.STRUCTURED;
    }

    @Override
    public void bind(PreparedStatement ps, BindContext ctx, Literal literal, Object value) {
      int pos = position(ctx);
      try {
        ps.setString(pos, jsonText(value));
      } catch (SQLException e) {
        throw new JdbcExecutionException("bind", e);
      }
    }
  }

  static final class JdbcSetObjectBinder implements Binder<PreparedStatement, Object> {
    @Override public Class<PreparedStatement> targetType() { return PreparedStatement.class; }
    @Override public Class<Object> valueType() { return Object.class; }
    @Override public boolean supports(BindContext ctx, Literal literal, Object value) { return true; }

    @Override
    public void bind(PreparedStatement ps, BindContext ctx, Literal literal, Object value) {
      int pos = position(ctx);
      try {
        ps.setObject(pos, value);
      } catch (SQLException e) {
        throw new JdbcExecutionException("bind", e);
      }
    }
  }
}
