package io.intellixity.quill.exec;

import io.intellixity.quill.compile.CompiledStatement;
import io.intellixity.quill.errors.CallingConventionMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Dispatches compiled statements to the single collaborator it was built with.
 * <p>
 * {@link #run} is the blocking entry point and {@link #runAsync} the non-blocking one. Using the one that does
 * not match the collaborator's convention fails synchronously with {@link CallingConventionMismatchException}
 * before the collaborator is touched.
 */
public final class ExecutionBridge {
  private static final Logger log = LoggerFactory.getLogger(ExecutionBridge.class);

  private final ExecutionCollaborator collaborator;

  public ExecutionBridge(ExecutionCollaborator collaborator) {
    this.collaborator = Objects.requireNonNull(collaborator, "collaborator");
    Objects.requireNonNull(collaborator.convention(), "collaborator.convention()");
  }

  public CallingConvention convention() { return collaborator.convention(); }

  public void checkConvention(CallingConvention requested) {
    Objects.requireNonNull(requested, "requested");
    CallingConvention actual = collaborator.convention();
    if (requested != actual) throw new CallingConventionMismatchException(requested, actual);
  }

  public RawRows run(CompiledStatement statement) {
    Objects.requireNonNull(statement, "statement");
    checkConvention(CallingConvention.BLOCKING);
    debugDispatch(CallingConvention.BLOCKING, statement);
    long start = System.nanoTime();
    RawRows rows = collaborator.execute(statement);
    debugDone(statement, rows, System.nanoTime() - start);
    return rows;
  }

  public CompletableFuture<RawRows> runAsync(CompiledStatement statement) {
    Objects.requireNonNull(statement, "statement");
    checkConvention(CallingConvention.NON_BLOCKING);
    debugDispatch(CallingConvention.NON_BLOCKING, statement);
    long start = System.nanoTime();
    CompletableFuture<RawRows> f = collaborator.executeAsync(statement);
    if (f == null) throw new IllegalStateException("Collaborator returned no future: " + collaborator.getClass().getName());
    if (!log.isDebugEnabled()) return f;
    return f.whenComplete((rows, err) -> {
      if (err == null) debugDone(statement, rows, System.nanoTime() - start);
      else log.debug("quill.exec_failed kind={} durationMs={} error={}",
          statement.kind(), (System.nanoTime() - start) / 1_000_000.0, err.toString());
    });
  }

  private static void debugDispatch(CallingConvention convention, CompiledStatement s) {
    if (!log.isDebugEnabled()) return;
    log.debug("quill.exec op={} convention={} execKind={} paramCount={} sql={}",
        s.kind(), convention, s.execKind(), s.params().size(), s.sql());
  }

  private static void debugDone(CompiledStatement s, RawRows rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("quill.exec_done op={} durationMs={} rows={} updateCount={}",
        s.kind(), durationNanos / 1_000_000.0,
        rows == null ? 0 : rows.size(), rows == null ? -1 : rows.updateCount());
  }
}
