package com.scholary.meeting.pipeline.dispatch;

import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import com.scholary.meeting.pipeline.pipeline.StageOutcome;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

/**
 * Publishes stage tasks to RabbitMQ as persistent JSON messages.
 *
 * <p>Redeliveries go to the retry queue whose TTL equals the delay; the broker moves them back to
 * the work queue when they expire.
 */
public class RabbitTaskDispatcher implements TaskDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(RabbitTaskDispatcher.class);

  static final String ERROR_HEADER = "x-pipeline-error";

  private final RabbitTemplate rabbitTemplate;
  private final RabbitTopology topology;

  public RabbitTaskDispatcher(RabbitTemplate rabbitTemplate, RabbitTopology topology) {
    this.rabbitTemplate = rabbitTemplate;
    this.topology = topology;
  }

  @Override
  public void enqueue(PipelineStage stage, String meetingId) {
    TaskMessage message = TaskMessage.first(stage, meetingId);
    send(RabbitTopology.WORK_ROUTING_KEY, message, null);
    LOGGER.debug("Enqueued {} for meeting {}", stage.stageName(), meetingId);
  }

  @Override
  public void redeliver(TaskMessage message, Duration delay) {
    send(topology.retryRoutingKey(delay), message, null);
  }

  @Override
  public void deadLetter(TaskMessage message, StageOutcome failure) {
    try {
      send(RabbitTopology.DEAD_LETTER_ROUTING_KEY, message, failure.reason());
    } catch (DispatchException e) {
      // the dead-letter record is already stored; the queue copy is best effort
      LOGGER.warn("Could not publish to dead-letter queue: {}", e.getMessage());
    }
  }

  private void send(String routingKey, TaskMessage message, String error) {
    try {
      rabbitTemplate.convertAndSend(
          topology.exchange(),
          routingKey,
          message,
          amqpMessage -> {
            amqpMessage.getMessageProperties().setMessageId(message.taskId());
            if (error != null) {
              amqpMessage.getMessageProperties().setHeader(ERROR_HEADER, error);
            }
            return amqpMessage;
          });
    } catch (AmqpException e) {
      throw new DispatchException(
          String.format(
              "Could not publish %s for meeting %s to %s",
              message.stage().stageName(), message.meetingId(), routingKey),
          e);
    }
  }
}
