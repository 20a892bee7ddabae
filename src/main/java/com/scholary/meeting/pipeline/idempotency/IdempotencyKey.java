package com.scholary.meeting.pipeline.idempotency;

import com.scholary.meeting.pipeline.pipeline.PipelineStage;

/** Identifies one stage of one meeting in the idempotency store. */
public record IdempotencyKey(String stageName, String meetingId) {

  private static final String PREFIX = "idempotency:";

  public static IdempotencyKey of(PipelineStage stage, String meetingId) {
    return new IdempotencyKey(stage.stageName(), meetingId);
  }

  /** The store key, {@code idempotency:{stageName}:{meetingId}}. */
  public String render() {
    return PREFIX + stageName + ":" + meetingId;
  }

  @Override
  public String toString() {
    return render();
  }
}
