package io.intellixity.quill.spi.exec;

import io.intellixity.quill.compile.CompiledStatement;
import io.intellixity.quill.errors.CallingConventionMismatchException;
import io.intellixity.quill.exec.CallingConvention;
import io.intellixity.quill.exec.ExecutionCollaborator;
import io.intellixity.quill.exec.RawRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Template for backends: {@link #acquire()} a connection context, {@link #run} the statement,
 * {@link #release} the context.
 * <p>
 * Blocking collaborators do all three on the caller's thread. Non-blocking collaborators do all three inside one
 * task on the worker {@link Executor}, so a connection context never outlives the task that acquired it and is
 * never touched by the caller's thread. There is no cancellation; failures surface unchanged (directly, or as
 * the cause of the future's {@link java.util.concurrent.CompletionException}).
 */
public abstract class AbstractExecutionCollaborator<C> implements ExecutionCollaborator {
  private static final Logger log = LoggerFactory.getLogger(AbstractExecutionCollaborator.class);

  private final CallingConvention convention;
  private final Executor worker;

  /** Blocking collaborator. */
  protected AbstractExecutionCollaborator() {
    this.convention = CallingConvention.BLOCKING;
    this.worker = null;
  }

  /** Non-blocking collaborator running every statement on {@code worker}. */
  protected AbstractExecutionCollaborator(Executor worker) {
    this.convention = CallingConvention.NON_BLOCKING;
    this.worker = Objects.requireNonNull(worker, "worker");
  }

  @Override
  public final CallingConvention convention() { return convention; }

  @Override
  public final RawRows execute(CompiledStatement statement) {
    Objects.requireNonNull(statement, "statement");
    if (convention != CallingConvention.BLOCKING) {
      throw new CallingConventionMismatchException(CallingConvention.BLOCKING, convention);
    }
    return runScoped(statement);
  }

  @Override
  public final CompletableFuture<RawRows> executeAsync(CompiledStatement statement) {
    Objects.requireNonNull(statement, "statement");
    if (convention != CallingConvention.NON_BLOCKING) {
      throw new CallingConventionMismatchException(CallingConvention.NON_BLOCKING, convention);
    }
    return CompletableFuture.supplyAsync(() -> runScoped(statement), worker);
  }

  private RawRows runScoped(CompiledStatement statement) {
    C ctx = acquire();
    if (log.isTraceEnabled()) {
      log.trace("quill.collaborator acquired type={} thread={}", getClass().getSimpleName(), Thread.currentThread().getName());
    }
    RawRows out;
    try {
      out = run(ctx, statement);
    } catch (RuntimeException | Error e) {
      // the statement failure wins; a failing release is attached to it
      try {
        release(ctx);
      } catch (RuntimeException releaseFailure) {
        e.addSuppressed(releaseFailure);
      }
      throw e;
    }
    release(ctx);
    if (log.isTraceEnabled()) {
      log.trace("quill.collaborator released type={} thread={}", getClass().getSimpleName(), Thread.currentThread().getName());
    }
    return out;
  }

  /** Obtain a connection context immediately before running a statement. */
  protected abstract C acquire();

  protected abstract RawRows run(C ctx, CompiledStatement statement);

  /**
   * Return the context obtained by {@link #acquire()}; always called, also after failures. When {@link #run} has
   * failed, an exception thrown here is added to that failure as suppressed.
   */
  protected abstract void release(C ctx);
}
