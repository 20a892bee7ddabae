package com.scholary.meeting.pipeline.dispatch;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import org.junit.jupiter.api.Test;

class StageTaskListenerTest {

  private final TaskProcessor processor = mock(TaskProcessor.class);
  private final TaskDispatcher dispatcher = mock(TaskDispatcher.class);
  private final StageTaskListener listener = new StageTaskListener(processor, dispatcher);

  @Test
  void processesMessageWithRabbitDispatcher() {
    TaskMessage message = TaskMessage.first(PipelineStage.INSIGHTS, "m1");

    listener.onMessage(message);

    verify(processor).process(message, dispatcher);
  }

  @Test
  void dispatchFailureEscapesSoContainerRequeues() {
    TaskMessage message = TaskMessage.first(PipelineStage.EMBEDDINGS, "m1");
    when(processor.process(message, dispatcher))
        .thenThrow(new DispatchException("broker down", null));

    assertThatThrownBy(() -> listener.onMessage(message)).isInstanceOf(DispatchException.class);
  }
}
