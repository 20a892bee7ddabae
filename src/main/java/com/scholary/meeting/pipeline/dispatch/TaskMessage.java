package com.scholary.meeting.pipeline.dispatch;

import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import java.util.UUID;

/**
 * The payload handed to a worker: which stage to run for which meeting, and how many times it has
 * already failed.
 *
 * <p>On the wire: {@code {"taskId":"…","stage":"transcribe","meetingId":"…","attempt":0}}. The
 * taskId is kept across retries so every attempt of one task can be correlated in the logs.
 */
public record TaskMessage(String taskId, PipelineStage stage, String meetingId, int attempt) {

  public TaskMessage {
    if (stage == null) {
      throw new IllegalArgumentException("stage is required");
    }
    if (meetingId == null || meetingId.isBlank()) {
      throw new IllegalArgumentException("meetingId is required");
    }
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must not be negative: " + attempt);
    }
  }

  /** A first attempt with a fresh task id. */
  public static TaskMessage first(PipelineStage stage, String meetingId) {
    return new TaskMessage(UUID.randomUUID().toString(), stage, meetingId, 0);
  }

  /** The same task, one attempt later. */
  public TaskMessage nextAttempt() {
    return new TaskMessage(taskId, stage, meetingId, attempt + 1);
  }
}
