package com.scholary.meeting.pipeline.dispatch;

import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import com.scholary.meeting.pipeline.pipeline.StageOutcome;
import java.time.Duration;

/**
 * Transport for stage tasks. Delivery is at-least-once; the stages are idempotent.
 *
 * @see TaskProcessor
 */
public interface TaskDispatcher {

  /**
   * Enqueue the first attempt of {@code stage} for a meeting.
   *
   * @throws DispatchException if the task could not be handed to the transport
   */
  void enqueue(PipelineStage stage, String meetingId);

  /**
   * Deliver {@code message} again after {@code delay}.
   *
   * @throws DispatchException if the task could not be handed to the transport
   */
  void redeliver(TaskMessage message, Duration delay);

  /**
   * Park a message the pipeline gave up on. Transports without a dead-letter destination only log
   * it; the dead-letter record itself is written by the failure handler.
   */
  void deadLetter(TaskMessage message, StageOutcome failure);
}
