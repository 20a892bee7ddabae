package com.scholary.meeting.pipeline.idempotency;

/**
 * Remembers that a stage finished for a meeting, for the length of the deduplication window.
 *
 * <p>Shares keys with {@link StageLock}: marking a key completed replaces its "processing" value.
 */
public interface CompletionMemo {

  boolean isCompleted(IdempotencyKey key);

  /** Record completion. Only after every side effect of the stage is durably committed. */
  void markCompleted(IdempotencyKey key);

  /** Forget a completion so the stage runs again. Used by manual re-drive only. */
  void forget(IdempotencyKey key);
}
