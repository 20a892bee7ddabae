package com.scholary.meeting.pipeline.dispatch;

import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import com.scholary.meeting.pipeline.pipeline.StageOutcome;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

/**
 * Dispatcher for a single process: a bounded worker pool runs the stages, a scheduler holds
 * delayed redeliveries.
 *
 * <p>Nothing survives a restart; use the RabbitMQ dispatcher when tasks must outlive the process.
 */
public class InProcessTaskDispatcher implements TaskDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(InProcessTaskDispatcher.class);

  private final TaskExecutor workers;
  private final TaskScheduler scheduler;
  private final TaskProcessor processor;
  private final Duration requeueDelay;

  public InProcessTaskDispatcher(
      TaskExecutor workers,
      TaskScheduler scheduler,
      TaskProcessor processor,
      Duration requeueDelay) {
    this.workers = workers;
    this.scheduler = scheduler;
    this.processor = processor;
    this.requeueDelay = requeueDelay;
  }

  @Override
  public void enqueue(PipelineStage stage, String meetingId) {
    submit(TaskMessage.first(stage, meetingId));
  }

  @Override
  public void redeliver(TaskMessage message, Duration delay) {
    scheduler.schedule(() -> submitOrRequeue(message), Instant.now().plus(delay));
  }

  @Override
  public void deadLetter(TaskMessage message, StageOutcome failure) {
    LOGGER.info(
        "Task abandoned: taskId={}, stage={}, meetingId={}",
        message.taskId(),
        message.stage().stageName(),
        message.meetingId());
  }

  private void submit(TaskMessage message) {
    try {
      workers.execute(() -> run(message));
    } catch (TaskRejectedException e) {
      throw new DispatchException(
          String.format(
              "Worker queue full, could not enqueue %s for meeting %s",
              message.stage().stageName(), message.meetingId()),
          e);
    }
  }

  private void run(TaskMessage message) {
    try {
      processor.process(message, this);
    } catch (RuntimeException e) {
      // treated like a broker requeue
      LOGGER.error(
          "Task failed after its stage ran, requeueing in {}s: taskId={}, stage={}, meetingId={}",
          requeueDelay.toSeconds(),
          message.taskId(),
          message.stage().stageName(),
          message.meetingId(),
          e);
      scheduler.schedule(() -> submitOrRequeue(message), Instant.now().plus(requeueDelay));
    }
  }

  private void submitOrRequeue(TaskMessage message) {
    try {
      submit(message);
    } catch (DispatchException e) {
      LOGGER.warn("{}; trying again in {}s", e.getMessage(), requeueDelay.toSeconds());
      scheduler.schedule(() -> submitOrRequeue(message), Instant.now().plus(requeueDelay));
    }
  }
}
