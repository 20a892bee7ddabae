package com.scholary.meeting.pipeline.dispatch;

import com.scholary.meeting.pipeline.deadletter.PipelineFailureHandler;
import com.scholary.meeting.pipeline.logging.StructuredLogger;
import com.scholary.meeting.pipeline.pipeline.PipelineGraph;
import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import com.scholary.meeting.pipeline.pipeline.StageHandler;
import com.scholary.meeting.pipeline.pipeline.StageOutcome;
import com.scholary.meeting.pipeline.retry.BackoffPolicy;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one task message through its stage and tells the transport what to do next.
 *
 * <ul>
 *   <li>completed or already completed: enqueue the next stage, if any
 *   <li>in flight elsewhere: drop the message
 *   <li>transient failure: redeliver after {@code delay(attempt)}, or dead-letter once the retry
 *       budget is spent
 *   <li>permanent failure: dead-letter at once
 * </ul>
 *
 * <p>The next stage is enqueued only after the handler has returned, so it always sees this
 * stage's committed output.
 */
@Component
public class TaskProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskProcessor.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final Map<PipelineStage, StageHandler> handlers = new EnumMap<>(PipelineStage.class);
  private final PipelineGraph graph;
  private final BackoffPolicy backoffPolicy;
  private final StageTimeLimiter timeLimiter;
  private final PipelineFailureHandler failureHandler;

  public TaskProcessor(
      List<StageHandler> stageHandlers,
      PipelineGraph graph,
      BackoffPolicy backoffPolicy,
      StageTimeLimiter timeLimiter,
      PipelineFailureHandler failureHandler) {
    for (StageHandler handler : stageHandlers) {
      if (handlers.put(handler.stage(), handler) != null) {
        throw new IllegalStateException("Two handlers for stage " + handler.stage());
      }
    }
    for (PipelineStage stage : graph.stages()) {
      if (!handlers.containsKey(stage)) {
        throw new IllegalStateException("No handler for pipeline stage " + stage);
      }
    }
    this.graph = graph;
    this.backoffPolicy = backoffPolicy;
    this.timeLimiter = timeLimiter;
    this.failureHandler = failureHandler;
  }

  /**
   * Process one delivery.
   *
   * @throws DispatchException if the follow-up message could not be published; the transport
   *     should then redeliver this message
   */
  public TaskDisposition process(TaskMessage message, TaskDispatcher dispatcher) {
    String stage = message.stage().stageName();
    StructuredLogger.setTaskContext(message.taskId(), stage, message.meetingId(), message.attempt());
    try {
      structuredLogger.logStageStarted(stage, message.meetingId(), message.attempt());
      long started = System.nanoTime();

      StageOutcome outcome = timeLimiter.run(handlers.get(message.stage()), message.meetingId());
      TaskDisposition disposition = decide(message, outcome);

      switch (disposition.action()) {
        case ACK_AND_CHAIN:
        case ACK:
          if (outcome.type() == StageOutcome.Type.COMPLETED) {
            structuredLogger.logStageCompleted(
                stage,
                message.meetingId(),
                disposition.nextStage() != null ? disposition.nextStage().stageName() : null,
                (System.nanoTime() - started) / 1_000_000);
          } else {
            structuredLogger.logStageSkipped(stage, message.meetingId(), outcome.type().name());
          }
          if (disposition.nextStage() != null) {
            dispatcher.enqueue(disposition.nextStage(), message.meetingId());
          }
          break;

        case RETRY:
          structuredLogger.logStageRetry(
              stage,
              message.meetingId(),
              message.attempt(),
              backoffPolicy.maxRetries(),
              disposition.retryDelay().toMillis(),
              outcome.reason());
          dispatcher.redeliver(message.nextAttempt(), disposition.retryDelay());
          break;

        case DEAD_LETTER:
          structuredLogger.logStageDeadLettered(
              stage, message.meetingId(), message.attempt(), outcome.type().name(), outcome.reason());
          failureHandler.onFailure(message, outcome);
          dispatcher.deadLetter(message, outcome);
          break;

        default:
          throw new IllegalStateException("Unhandled disposition " + disposition.action());
      }
      return disposition;

    } finally {
      StructuredLogger.clearTaskContext();
    }
  }

  /** Map an outcome to a disposition. Has no side effects. */
  public TaskDisposition decide(TaskMessage message, StageOutcome outcome) {
    switch (outcome.type()) {
      case COMPLETED:
      case ALREADY_COMPLETED:
        return graph
            .next(message.stage())
            .map(TaskDisposition::ackAndChain)
            .orElseGet(TaskDisposition::ack);
      case IN_FLIGHT:
        return TaskDisposition.ack();
      case TRANSIENT_FAILURE:
        if (backoffPolicy.isExhausted(message.attempt())) {
          return TaskDisposition.deadLetter();
        }
        return TaskDisposition.retry(backoffPolicy.delay(message.attempt()));
      case PERMANENT_FAILURE:
        return TaskDisposition.deadLetter();
      default:
        throw new IllegalStateException("Unknown outcome " + outcome.type());
    }
  }
}
