package com.scholary.meeting.pipeline.idempotency;

/**
 * Mutual exclusion for one stage of one meeting.
 *
 * <p>A held lock expires on its own after a bounded TTL so that a crashed worker cannot block
 * retries forever.
 */
public interface StageLock {

  /**
   * Try to move the key from absent to "processing".
   *
   * @return true if this caller now holds the lock
   */
  boolean tryAcquire(IdempotencyKey key);

  /** Drop the key so that a later retry or redelivery can acquire it again. */
  void release(IdempotencyKey key);
}
