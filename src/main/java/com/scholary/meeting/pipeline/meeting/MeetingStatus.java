package com.scholary.meeting.pipeline.meeting;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a meeting as observed and advanced by the pipeline stages.
 *
 * <p>Success path: PENDING → PROCESSING → TRANSCRIBED → READY. ERROR is reachable from PROCESSING
 * and TRANSCRIBED. READY and ERROR are terminal for the automatic pipeline; ERROR goes back to
 * PENDING only through a manual re-drive.
 */
public enum MeetingStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  TRANSCRIBED("transcribed"),
  READY("ready"),
  ERROR("error");

  private final String value;

  MeetingStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Whether the automatic pipeline may move a meeting from this status to {@code next}.
   *
   * <p>Staying in the same status is always allowed so that retried stages can re-apply their
   * transition.
   */
  public boolean canTransitionTo(MeetingStatus next) {
    return this == next || successors().contains(next);
  }

  /** Whether a manual re-drive may reset this status to PENDING. */
  public boolean canRedrive() {
    return this == ERROR;
  }

  private Set<MeetingStatus> successors() {
    switch (this) {
      case PENDING:
        return EnumSet.of(PROCESSING);
      case PROCESSING:
        return EnumSet.of(TRANSCRIBED, ERROR);
      case TRANSCRIBED:
        return EnumSet.of(READY, ERROR);
      default:
        return EnumSet.noneOf(MeetingStatus.class);
    }
  }
}
