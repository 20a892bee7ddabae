package com.scholary.meeting.pipeline.idempotency;

import com.scholary.meeting.pipeline.pipeline.PipelineStage;

/** Creates a fresh {@link IdempotencyGuard} for each stage invocation. */
public class IdempotencyGuardFactory {

  private final StageLock lock;
  private final CompletionMemo memo;

  public IdempotencyGuardFactory(StageLock lock, CompletionMemo memo) {
    this.lock = lock;
    this.memo = memo;
  }

  public IdempotencyGuard forStage(PipelineStage stage, String meetingId) {
    return new IdempotencyGuard(IdempotencyKey.of(stage, meetingId), lock, memo);
  }

  /** Forget every stage's completion for a meeting so a re-drive runs the whole chain. */
  public void forgetAll(String meetingId) {
    for (PipelineStage stage : PipelineStage.values()) {
      memo.forget(IdempotencyKey.of(stage, meetingId));
    }
  }
}
