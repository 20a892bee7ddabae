package com.scholary.meeting.pipeline.dispatch;

import org.springframework.amqp.rabbit.annotation.RabbitListener;

/**
 * Consumes the work queue.
 *
 * <p>The container acknowledges after this method returns. If it throws, the message is requeued;
 * a message that cannot be converted is rejected to the dead-letter queue.
 */
public class StageTaskListener {

  private final TaskProcessor processor;
  private final TaskDispatcher dispatcher;

  public StageTaskListener(TaskProcessor processor, TaskDispatcher dispatcher) {
    this.processor = processor;
    this.dispatcher = dispatcher;
  }

  @RabbitListener(
      queues = "${pipeline.rabbit.work-queue}",
      containerFactory = "stageListenerContainerFactory")
  public void onMessage(TaskMessage message) {
    processor.process(message, dispatcher);
  }
}
