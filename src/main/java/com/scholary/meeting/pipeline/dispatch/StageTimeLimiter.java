package com.scholary.meeting.pipeline.dispatch;

import com.scholary.meeting.pipeline.pipeline.StageHandler;
import com.scholary.meeting.pipeline.pipeline.StageOutcome;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

/**
 * Runs a stage on a separate thread under two deadlines.
 *
 * <p>At the soft limit the stage thread is interrupted, so a well-behaved stage leaves through its
 * own failure path and releases its lock. At the hard limit the caller stops waiting and reports a
 * permanent failure, so the task is dead-lettered and the meeting moves to error. The abandoned
 * thread keeps the stage's "processing" marker until it finishes.
 */
public class StageTimeLimiter {

  private static final Logger LOGGER = LoggerFactory.getLogger(StageTimeLimiter.class);

  private final AsyncTaskExecutor executor;
  private final Duration softLimit;
  private final Duration hardLimit;

  public StageTimeLimiter(AsyncTaskExecutor executor, Duration softLimit, Duration hardLimit) {
    if (softLimit.isNegative() || softLimit.isZero()) {
      throw new IllegalArgumentException("soft limit must be positive: " + softLimit);
    }
    if (hardLimit.compareTo(softLimit) < 0) {
      throw new IllegalArgumentException(
          "hard limit must not be shorter than soft limit: " + hardLimit + " < " + softLimit);
    }
    this.executor = executor;
    this.softLimit = softLimit;
    this.hardLimit = hardLimit;
  }

  public StageOutcome run(StageHandler handler, String meetingId) {
    CompletableFuture<StageOutcome> result = new CompletableFuture<>();
    Future<?> running;
    try {
      running =
          executor.submit(
              () -> {
                try {
                  result.complete(handler.handle(meetingId));
                } catch (Throwable t) {
                  result.completeExceptionally(t);
                }
              });
    } catch (TaskRejectedException e) {
      return StageOutcome.transientFailure("No stage thread available", e);
    }

    try {
      return result.get(softLimit.toMillis(), TimeUnit.MILLISECONDS);

    } catch (TimeoutException e) {
      LOGGER.warn(
          "Stage exceeded soft time limit of {}s, interrupting: stage={}, meetingId={}",
          softLimit.toSeconds(),
          handler.stage().stageName(),
          meetingId);
      running.cancel(true);
      return awaitAfterInterrupt(handler, meetingId, result);

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running.cancel(true);
      return StageOutcome.transientFailure("Worker interrupted while waiting for stage", e);

    } catch (ExecutionException e) {
      return StageOutcome.transientFailure(
          "Stage crashed: " + e.getCause(), e.getCause() != null ? e.getCause() : e);
    }
  }

  private StageOutcome awaitAfterInterrupt(
      StageHandler handler, String meetingId, CompletableFuture<StageOutcome> result) {
    Duration grace = hardLimit.minus(softLimit);
    try {
      // usually a failure from the interrupt, but the stage may have committed just before it
      return result.get(grace.toMillis(), TimeUnit.MILLISECONDS);

    } catch (TimeoutException e) {
      LOGGER.error(
          "Stage exceeded hard time limit of {}s, abandoning it: stage={}, meetingId={}",
          hardLimit.toSeconds(),
          handler.stage().stageName(),
          meetingId);
      result.whenComplete(
          (late, error) ->
              LOGGER.warn(
                  "Abandoned stage finished after hard time limit: stage={}, meetingId={}, outcome={}",
                  handler.stage().stageName(),
                  meetingId,
                  late != null ? late.type() : String.valueOf(error)));
      return StageOutcome.permanentFailure(
          "Stage exceeded hard time limit of " + hardLimit.toSeconds() + "s", e);

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return StageOutcome.transientFailure("Worker interrupted while waiting for stage", e);

    } catch (ExecutionException e) {
      return StageOutcome.transientFailure(
          "Stage crashed: " + e.getCause(), e.getCause() != null ? e.getCause() : e);
    }
  }
}
