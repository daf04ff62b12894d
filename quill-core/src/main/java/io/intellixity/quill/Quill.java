package io.intellixity.quill;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.quill.compile.SqlCompiler;
import io.intellixity.quill.dialect.Dialect;
import io.intellixity.quill.dialect.DialectRegistry;
import io.intellixity.quill.exec.ExecutionBridge;
import io.intellixity.quill.exec.ExecutionCollaborator;
import io.intellixity.quill.mapping.ColumnCollisionPolicy;
import io.intellixity.quill.mapping.ResultMaterializer;
import io.intellixity.quill.schema.TableSchema;
import io.intellixity.quill.stmt.DeleteBuilder;
import io.intellixity.quill.stmt.InsertBuilder;
import io.intellixity.quill.stmt.SelectBuilder;
import io.intellixity.quill.stmt.UpdateBuilder;
import io.intellixity.quill.validate.ValueValidator;

import java.util.Objects;

/**
 * Entry point: one dialect, at most one execution collaborator, one result materializer.
 *
 * <pre>
 * Quill q = Quill.builder().dialect(Dialects.POSTGRES).executor(jdbc).build();
 * List&lt;Map&lt;String, Object&gt;&gt; rows = q.select("id", "name").from(users).where(eq(users.col("id"), 42)).fetch();
 * </pre>
 *
 * Without an executor statements can still be built and inspected via {@code sql()} / {@code params()}.
 * Instances are immutable and may be shared; builders they create may not.
 */
public final class Quill {
  private final Dialect dialect;
  private final ExecutionBridge bridge;
  private final ResultMaterializer materializer;
  private final SqlCompiler compiler = new SqlCompiler();
  private final ValueValidator validator = new ValueValidator();

  private Quill(Builder b) {
    this.dialect = Objects.requireNonNull(b.dialect, "dialect");
    this.bridge = b.executor == null ? null : new ExecutionBridge(b.executor);
    this.materializer = new ResultMaterializer(b.collisionPolicy, b.objectMapper == null ? new ObjectMapper() : b.objectMapper);
  }

  public static Builder builder() { return new Builder(); }

  public SelectBuilder select(Object... items) { return new SelectBuilder(this, false, items); }
  public SelectBuilder selectDistinct(Object... items) { return new SelectBuilder(this, true, items); }
  public InsertBuilder insert(TableSchema table) { return new InsertBuilder(this, table); }
  public UpdateBuilder update(TableSchema table) { return new UpdateBuilder(this, table); }
  public DeleteBuilder delete(TableSchema table) { return new DeleteBuilder(this, table); }

  public Dialect dialect() { return dialect; }
  public SqlCompiler compiler() { return compiler; }
  public ResultMaterializer materializer() { return materializer; }
  public ValueValidator validator() { return validator; }

  public ExecutionBridge bridge() {
    if (bridge == null) throw new IllegalStateException("No execution collaborator configured for this Quill instance");
    return bridge;
  }

  public static final class Builder {
    private Dialect dialect;
    private ExecutionCollaborator executor;
    private ColumnCollisionPolicy collisionPolicy = ColumnCollisionPolicy.LAST_JOINED_WINS;
    private ObjectMapper objectMapper;
    private DialectRegistry dialects;

    private Builder() {}

    public Builder dialect(Dialect dialect) {
      this.dialect = Objects.requireNonNull(dialect, "dialect");
      return this;
    }

    /** Resolve the dialect by id through {@link DialectRegistry}. */
    public Builder dialect(String id) {
      if (dialects == null) dialects = new DialectRegistry();
      return dialect(dialects.get(id));
    }

    public Builder dialects(DialectRegistry registry) {
      this.dialects = Objects.requireNonNull(registry, "registry");
      return this;
    }

    public Builder executor(ExecutionCollaborator executor) {
      this.executor = Objects.requireNonNull(executor, "executor");
      return this;
    }

    public Builder collisionPolicy(ColumnCollisionPolicy policy) {
      this.collisionPolicy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    /** Mapper used to decode structured result columns. */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
      return this;
    }

    public Quill build() {
      if (dialect == null) throw new IllegalStateException("dialect is required");
      return new Quill(this);
    }
  }
}
