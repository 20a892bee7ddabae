package com.scholary.meeting.pipeline.pipeline;

import com.scholary.meeting.pipeline.idempotency.IdempotencyGuard;
import com.scholary.meeting.pipeline.idempotency.IdempotencyGuardFactory;
import com.scholary.meeting.pipeline.meeting.Meeting;
import com.scholary.meeting.pipeline.meeting.MeetingRepository;
import com.scholary.meeting.pipeline.meeting.MeetingStatus;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared shape of every stage.
 *
 * <ol>
 *   <li>Already completed: skip the work but report success so the next stage is still enqueued.
 *   <li>Lock held elsewhere: report in-flight and touch nothing.
 *   <li>Run {@link #execute}: load input, call the collaborator once, upsert, advance status.
 *   <li>Mark completed. Chaining happens afterwards in the dispatch layer.
 *   <li>On any failure release the lock and report transient or permanent failure.
 * </ol>
 */
public abstract class AbstractStageHandler implements StageHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractStageHandler.class);

  private final IdempotencyGuardFactory guards;
  protected final MeetingRepository meetingRepository;

  protected AbstractStageHandler(
      IdempotencyGuardFactory guards, MeetingRepository meetingRepository) {
    this.guards = guards;
    this.meetingRepository = meetingRepository;
  }

  @Override
  public final StageOutcome handle(String meetingId) {
    IdempotencyGuard guard = guards.forStage(stage(), meetingId);

    try {
      if (guard.isCompleted()) {
        LOGGER.info(
            "Stage already completed, skipping: stage={}, meetingId={}",
            stage().stageName(),
            meetingId);
        return StageOutcome.alreadyCompleted();
      }

      if (!guard.acquire()) {
        LOGGER.info(
            "Stage already in progress elsewhere, skipping: stage={}, meetingId={}",
            stage().stageName(),
            meetingId);
        return StageOutcome.inFlight();
      }
    } catch (RuntimeException e) {
      // store unreachable before anything was done; nothing to release
      return StageOutcome.transientFailure("Idempotency store unavailable: " + describe(e), e);
    }

    try {
      execute(meetingId);
      guard.markCompleted();
      return StageOutcome.completed();

    } catch (PermanentStageException e) {
      releaseQuietly(guard, e);
      return StageOutcome.permanentFailure(e.getMessage(), e);

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      releaseQuietly(guard, e);
      return StageOutcome.transientFailure("Stage interrupted", e);

    } catch (Exception e) {
      releaseQuietly(guard, e);
      return StageOutcome.transientFailure(describe(e), e);
    }
  }

  /**
   * Do the stage's work: load input, call the collaborator, persist, advance status.
   *
   * <p>Throw {@link PermanentStageException} for input errors. Anything else is retried.
   */
  protected abstract void execute(String meetingId) throws Exception;

  /** Load the meeting and check that its status is one this stage can start from. */
  protected Meeting requireMeeting(String meetingId, MeetingStatus... allowed) {
    Meeting meeting =
        meetingRepository
            .findById(meetingId)
            .orElseThrow(() -> PermanentStageException.meetingNotFound(meetingId));

    if (!Arrays.asList(allowed).contains(meeting.status())) {
      throw new PermanentStageException(
          String.format(
              "Meeting %s is %s, stage %s requires one of %s",
              meetingId, meeting.status().value(), stage().stageName(), Arrays.toString(allowed)));
    }
    return meeting;
  }

  /** Apply a status transition, failing permanently if the state machine rejects it. */
  protected void advanceStatus(String meetingId, MeetingStatus target) {
    if (!meetingRepository.transition(meetingId, target)) {
      throw new PermanentStageException(
          String.format("Meeting %s cannot move to %s", meetingId, target.value()));
    }
  }

  private void releaseQuietly(IdempotencyGuard guard, Exception failure) {
    try {
      guard.release();
    } catch (RuntimeException e) {
      // the processing marker expires on its own TTL
      LOGGER.warn(
          "Could not release idempotency lock {} after failure '{}': {}",
          guard.key(),
          describe(failure),
          e.getMessage());
      failure.addSuppressed(e);
    }
  }

  private static String describe(Throwable e) {
    String message = e.getMessage();
    return message == null || message.isBlank()
        ? e.getClass().getSimpleName()
        : e.getClass().getSimpleName() + ": " + message;
  }
}
