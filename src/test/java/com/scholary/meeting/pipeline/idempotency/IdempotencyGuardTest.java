package com.scholary.meeting.pipeline.idempotency;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IdempotencyGuardTest {

  private final AtomicLong nanos = new AtomicLong();

  private IdempotencyLedger ledger;
  private IdempotencyGuardFactory guards;

  @BeforeEach
  void setUp() {
    Ticker ticker = nanos::get;
    ledger =
        new IdempotencyLedger(
            new CaffeineIdempotencyStore(1000, ticker), Duration.ofHours(1), Duration.ofHours(24));
    guards = new IdempotencyGuardFactory(ledger, ledger);
  }

  @Test
  void key_shouldRenderStageAndMeeting() {
    IdempotencyGuard guard = guards.forStage(PipelineStage.TRANSCRIBE, "m1");

    assertThat(guard.key().render()).isEqualTo("idempotency:transcribe:m1");
  }

  @Test
  void secondAcquire_shouldFailWhileFirstHoldsLock() {
    IdempotencyGuard first = guards.forStage(PipelineStage.INSIGHTS, "m1");
    IdempotencyGuard second = guards.forStage(PipelineStage.INSIGHTS, "m1");

    assertThat(first.acquire()).isTrue();
    assertThat(second.acquire()).isFalse();
    assertThat(second.isCompleted()).isFalse();
  }

  @Test
  void release_shouldLetAnotherInvocationAcquire() {
    IdempotencyGuard first = guards.forStage(PipelineStage.INSIGHTS, "m1");
    first.acquire();
    first.release();

    assertThat(first.isHeld()).isFalse();
    assertThat(guards.forStage(PipelineStage.INSIGHTS, "m1").acquire()).isTrue();
  }

  @Test
  void markCompleted_shouldBeVisibleToLaterInvocations() {
    IdempotencyGuard first = guards.forStage(PipelineStage.EMBEDDINGS, "m1");
    first.acquire();
    first.markCompleted();

    IdempotencyGuard duplicate = guards.forStage(PipelineStage.EMBEDDINGS, "m1");
    assertThat(duplicate.isCompleted()).isTrue();
    assertThat(duplicate.acquire()).isFalse();
    assertThat(ledger.state(duplicate.key())).contains("completed");
  }

  @Test
  void markCompleted_withoutLock_shouldFail() {
    IdempotencyGuard guard = guards.forStage(PipelineStage.EMBEDDINGS, "m1");

    assertThatThrownBy(guard::markCompleted).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void release_afterCompletion_shouldFail() {
    IdempotencyGuard guard = guards.forStage(PipelineStage.EMBEDDINGS, "m1");
    guard.acquire();
    guard.markCompleted();

    assertThatThrownBy(guard::release).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void staleLock_shouldExpireAfterProcessingTtl() {
    guards.forStage(PipelineStage.TRANSCRIBE, "m1").acquire();

    nanos.addAndGet(Duration.ofMinutes(61).toNanos());

    assertThat(guards.forStage(PipelineStage.TRANSCRIBE, "m1").acquire()).isTrue();
  }

  @Test
  void forgetAll_shouldClearEveryStageOfOneMeeting() {
    for (PipelineStage stage : PipelineStage.values()) {
      IdempotencyGuard guard = guards.forStage(stage, "m1");
      guard.acquire();
      guard.markCompleted();
    }
    IdempotencyGuard other = guards.forStage(PipelineStage.TRANSCRIBE, "m2");
    other.acquire();
    other.markCompleted();

    guards.forgetAll("m1");

    for (PipelineStage stage : PipelineStage.values()) {
      assertThat(guards.forStage(stage, "m1").isCompleted()).isFalse();
    }
    assertThat(guards.forStage(PipelineStage.TRANSCRIBE, "m2").isCompleted()).isTrue();
  }
}
