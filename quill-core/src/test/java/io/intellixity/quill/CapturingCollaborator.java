package io.intellixity.quill;

import io.intellixity.quill.compile.CompiledStatement;
import io.intellixity.quill.exec.CallingConvention;
import io.intellixity.quill.exec.ExecutionCollaborator;
import io.intellixity.quill.exec.RawRows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Records every statement it receives and answers with a canned result. */
public final class CapturingCollaborator implements ExecutionCollaborator {
  private final CallingConvention convention;
  public final List<CompiledStatement> executed = new ArrayList<>();
  public RawRows result = RawRows.updateCount(0);

  public CapturingCollaborator(CallingConvention convention) {
    this.convention = convention;
  }

  public CapturingCollaborator returning(RawRows result) {
    this.result = result;
    return this;
  }

  @Override public CallingConvention convention() { return convention; }

  @Override
  public RawRows execute(CompiledStatement statement) {
    executed.add(statement);
    return result;
  }

  @Override
  public CompletableFuture<RawRows> executeAsync(CompiledStatement statement) {
    executed.add(statement);
    return CompletableFuture.completedFuture(result);
  }
}
