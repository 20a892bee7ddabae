package com.scholary.meeting.pipeline.idempotency;

/**
 * Lock and completion marker for a single stage invocation.
 *
 * <p>One guard per invocation; not shared between threads. The guard remembers whether this
 * invocation won {@link #acquire()}, so only the winner can complete or release.
 */
public class IdempotencyGuard {

  private final IdempotencyKey key;
  private final StageLock lock;
  private final CompletionMemo memo;

  private boolean acquired;
  private boolean completed;

  IdempotencyGuard(IdempotencyKey key, StageLock lock, CompletionMemo memo) {
    this.key = key;
    this.lock = lock;
    this.memo = memo;
  }

  public IdempotencyKey key() {
    return key;
  }

  /** True iff the stage already completed for this meeting inside the dedup window. */
  public boolean isCompleted() {
    return memo.isCompleted(key);
  }

  /**
   * Try to take the lock.
   *
   * @return true if this invocation may run the stage's side effects
   */
  public boolean acquire() {
    acquired = lock.tryAcquire(key);
    return acquired;
  }

  /** Record completion. Call after every side effect is committed and before chaining. */
  public void markCompleted() {
    if (!acquired) {
      throw new IllegalStateException("Cannot complete without holding the lock: " + key);
    }
    memo.markCompleted(key);
    completed = true;
  }

  /** Drop the lock after a failure. No-op if this invocation never held it. */
  public void release() {
    if (completed) {
      throw new IllegalStateException("Cannot release a completed stage: " + key);
    }
    if (acquired) {
      lock.release(key);
      acquired = false;
    }
  }

  public boolean isHeld() {
    return acquired && !completed;
  }
}
