package com.scholary.meeting.pipeline.pipeline;

/**
 * Result of one stage invocation.
 *
 * <p>The dispatch layer turns this into chaining, redelivery or dead-lettering; handlers never
 * signal retries by throwing.
 */
public record StageOutcome(Type type, String reason, Throwable cause) {

  public enum Type {
    /** This invocation did the work and committed it. */
    COMPLETED,
    /** Duplicate delivery of a stage that already finished; the work was skipped. */
    ALREADY_COMPLETED,
    /** Another worker holds the lock for this stage; nothing was done. */
    IN_FLIGHT,
    /** Worth retrying after a backoff. */
    TRANSIENT_FAILURE,
    /** Retrying cannot help. */
    PERMANENT_FAILURE
  }

  public static StageOutcome completed() {
    return new StageOutcome(Type.COMPLETED, null, null);
  }

  public static StageOutcome alreadyCompleted() {
    return new StageOutcome(Type.ALREADY_COMPLETED, null, null);
  }

  public static StageOutcome inFlight() {
    return new StageOutcome(Type.IN_FLIGHT, null, null);
  }

  public static StageOutcome transientFailure(String reason, Throwable cause) {
    return new StageOutcome(Type.TRANSIENT_FAILURE, reason, cause);
  }

  public static StageOutcome permanentFailure(String reason, Throwable cause) {
    return new StageOutcome(Type.PERMANENT_FAILURE, reason, cause);
  }

  /** Whether the next stage should be enqueued. True for duplicates too, so the chain never stalls. */
  public boolean chainsToNext() {
    return type == Type.COMPLETED || type == Type.ALREADY_COMPLETED;
  }

  public boolean isFailure() {
    return type == Type.TRANSIENT_FAILURE || type == Type.PERMANENT_FAILURE;
  }
}
