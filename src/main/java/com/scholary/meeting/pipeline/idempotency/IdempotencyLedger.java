package com.scholary.meeting.pipeline.idempotency;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link StageLock} and {@link CompletionMemo} over a single {@link IdempotencyStore}.
 *
 * <p>Values are "processing" (lock held, short TTL) and "completed" (memo, long TTL).
 */
public class IdempotencyLedger implements StageLock, CompletionMemo {

  static final String PROCESSING = "processing";
  static final String COMPLETED = "completed";

  private final IdempotencyStore store;
  private final Duration processingTtl;
  private final Duration completedTtl;

  public IdempotencyLedger(IdempotencyStore store, Duration processingTtl, Duration completedTtl) {
    if (completedTtl.compareTo(processingTtl) < 0) {
      throw new IllegalArgumentException(
          "completed TTL must not be shorter than processing TTL: "
              + completedTtl
              + " < "
              + processingTtl);
    }
    this.store = store;
    this.processingTtl = processingTtl;
    this.completedTtl = completedTtl;
  }

  @Override
  public boolean tryAcquire(IdempotencyKey key) {
    return store.setIfAbsent(key.render(), PROCESSING, processingTtl);
  }

  @Override
  public void release(IdempotencyKey key) {
    store.delete(key.render());
  }

  @Override
  public boolean isCompleted(IdempotencyKey key) {
    return store.get(key.render()).filter(COMPLETED::equals).isPresent();
  }

  @Override
  public void markCompleted(IdempotencyKey key) {
    store.set(key.render(), COMPLETED, completedTtl);
  }

  @Override
  public void forget(IdempotencyKey key) {
    store.delete(key.render());
  }

  /** Raw marker value, for diagnostics. */
  public Optional<String> state(IdempotencyKey key) {
    return store.get(key.render());
  }
}
