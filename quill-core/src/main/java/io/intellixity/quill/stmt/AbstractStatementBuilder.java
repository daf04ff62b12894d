package io.intellixity.quill.stmt;

import io.intellixity.quill.Quill;
import io.intellixity.quill.compile.CompiledStatement;
import io.intellixity.quill.errors.QueryConstructionException;
import io.intellixity.quill.exec.CallingConvention;
import io.intellixity.quill.query.Literal;
import io.intellixity.quill.query.Predicate;

import java.util.*;

/**
 * Common lifecycle for statement builders.
 * <p>
 * A builder accumulates clauses into its own {@link StatementState} and is consumed by exactly one execution
 * trigger. {@link #compile()}, {@link #sql()} and {@link #params()} may be called at any time and never change
 * the state; after the trigger they return the compiled statement that was executed. Clause calls or a second
 * trigger after consumption fail with {@link QueryConstructionException}.
 * <p>
 * Not thread-safe.
 */
public abstract class AbstractStatementBuilder<B extends AbstractStatementBuilder<B>> {
  protected final Quill quill;
  protected final StatementState state;
  private CompiledStatement executed;

  protected AbstractStatementBuilder(Quill quill, StatementKind kind) {
    this.quill = Objects.requireNonNull(quill, "quill");
    this.state = new StatementState(kind);
  }

  protected abstract B self();

  /** Payload checks run before every compilation. */
  protected void validate() {}

  public final StatementState state() { return state; }
  public final boolean isExecuted() { return executed != null; }

  public final CompiledStatement compile() {
    if (executed != null) return executed;
    validate();
    return quill.compiler().compile(state, quill.dialect());
  }

  public final String sql() { return compile().sql(); }

  /** Parameter values in placeholder order. */
  public final List<Object> params() { return compile().paramValues(); }

  protected final void checkOpen() {
    if (executed != null) {
      throw new QueryConstructionException(state.kind() + " statement was already executed; build a new one");
    }
  }

  /**
   * Marks this builder consumed and returns the statement to run. The calling convention is checked first,
   * so a mismatch leaves the builder untouched.
   */
  protected final CompiledStatement consume(CallingConvention convention) {
    checkOpen();
    quill.bridge().checkConvention(convention);
    CompiledStatement c = compile();
    executed = c;
    return c;
  }

  protected final B addWhere(Predicate... predicates) {
    checkOpen();
    if (predicates == null || predicates.length == 0) {
      throw new QueryConstructionException("where() requires at least one predicate");
    }
    for (Predicate p : predicates) {
      if (p == null) throw new QueryConstructionException("where() does not accept null predicates");
    }
    for (Predicate p : predicates) state.addWhere(p);
    return self();
  }

  protected final B setLimit(long limit) {
    checkOpen();
    if (limit < 0) throw new QueryConstructionException("limit must be non-negative, got " + limit);
    state.limit(limit);
    return self();
  }

  static Map<String, Literal> toLiterals(Map<String, ?> row, String what) {
    if (row == null) throw new QueryConstructionException(what + " must not be null");
    if (row.isEmpty()) throw new QueryConstructionException(what + " has no columns");
    Map<String, Literal> out = new LinkedHashMap<>();
    for (Map.Entry<String, ?> e : row.entrySet()) {
      String k = e.getKey();
      if (k == null || k.isBlank()) throw new QueryConstructionException(what + " contains a blank column name");
      out.put(k, Literal.of(e.getValue()));
    }
    return out;
  }
}
