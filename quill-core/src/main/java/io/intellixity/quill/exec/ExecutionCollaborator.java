package io.intellixity.quill.exec;

import io.intellixity.quill.compile.CompiledStatement;

import java.util.concurrent.CompletableFuture;

/**
 * Owns the physical connection and runs compiled statements.
 * <p>
 * Each implementation declares one {@link #convention()}; {@link ExecutionBridge} only calls the matching
 * method. Failures (connectivity, constraint violations) propagate as thrown, or as the future's exceptional
 * completion; no retries.
 */
public interface ExecutionCollaborator {
  CallingConvention convention();

  RawRows execute(CompiledStatement statement);

  CompletableFuture<RawRows> executeAsync(CompiledStatement statement);
}
