package io.intellixity.quill.jdbc.postgres;

import io.intellixity.quill.dialect.Dialects;
import io.intellixity.quill.jdbc.JdbcExecutionException;
import io.intellixity.quill.jdbc.bind.JdbcBinderProvider;
import io.intellixity.quill.query.Literal;
import io.intellixity.quill.query.LiteralType;
import io.intellixity.quill.spi.bind.BindContext;
import io.intellixity.quill.spi.bind.Binder;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

/** Postgres-specific JDBC binders (dialectId="postgres"). */
public final class PostgresBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() {
    return Dialects.POSTGRES.id();
  }

  @Override
  protected Collection<Binder<?, ?>> dialectBinders() {
    return List.of(new PostgresJsonbBinder());
  }

  /** STRUCTURED values go over the wire as jsonb, so they compare and index like native jsonb columns. */
  static final class PostgresJsonbBinder implements Binder<PreparedStatement, Object> {
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
        PGobject obj = new PGobject();
        obj.setType("jsonb");
        obj.setValue(jsonText(value));
        ps.setObject(pos, obj);
      } catch (SQLException e) {
        throw new JdbcExecutionException("bind", e);
      }
    }
  }
}
