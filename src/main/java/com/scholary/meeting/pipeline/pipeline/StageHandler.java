package com.scholary.meeting.pipeline.pipeline;

/** Executes one pipeline stage for one meeting. */
public interface StageHandler {

  PipelineStage stage();

  /**
   * Run the stage.
   *
   * <p>Implementations never throw: every failure is reported as a {@link StageOutcome}.
   *
   * @param meetingId the meeting to process
   * @return what happened
   */
  StageOutcome handle(String meetingId);
}
