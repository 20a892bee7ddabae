package com.scholary.meeting.pipeline.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class InProcessTaskDispatcherTest {

  @Mock private TaskScheduler scheduler;
  @Mock private TaskProcessor processor;

  private InProcessTaskDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    dispatcher =
        new InProcessTaskDispatcher(
            new SyncTaskExecutor(), scheduler, processor, Duration.ofSeconds(5));
  }

  @Test
  void enqueue_shouldRunFirstAttemptOnWorker() {
    dispatcher.enqueue(PipelineStage.TRANSCRIBE, "m1");

    ArgumentCaptor<TaskMessage> message = ArgumentCaptor.forClass(TaskMessage.class);
    verify(processor).process(message.capture(), same(dispatcher));
    assertThat(message.getValue().stage()).isEqualTo(PipelineStage.TRANSCRIBE);
    assertThat(message.getValue().meetingId()).isEqualTo("m1");
    assertThat(message.getValue().attempt()).isZero();
  }

  @Test
  void redeliver_shouldScheduleAfterDelay() {
    TaskMessage message = new TaskMessage("t1", PipelineStage.INSIGHTS, "m1", 1);
    Instant before = Instant.now();

    dispatcher.redeliver(message, Duration.ofSeconds(20));

    ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
    ArgumentCaptor<Instant> when = ArgumentCaptor.forClass(Instant.class);
    verify(scheduler).schedule(task.capture(), when.capture());
    assertThat(when.getValue()).isAfterOrEqualTo(before.plusSeconds(20));
    verify(processor, never()).process(any(), any());

    task.getValue().run();
    verify(processor).process(message, dispatcher);
  }

  @Test
  void processorFailure_shouldRequeueMessage() {
    TaskMessage message = new TaskMessage("t1", PipelineStage.INSIGHTS, "m1", 0);
    when(processor.process(message, dispatcher))
        .thenThrow(new DispatchException("cannot chain", null));

    dispatcher.redeliver(message, Duration.ZERO);
    ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
    verify(scheduler).schedule(task.capture(), any(Instant.class));
    task.getValue().run();

    // the first schedule call was the redelivery itself, the second the requeue
    verify(scheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
  }

  @Test
  void fullWorkerQueue_shouldFailEnqueue(@Mock TaskExecutor fullExecutor) {
    doThrow(new TaskRejectedException("full")).when(fullExecutor).execute(any(Runnable.class));
    InProcessTaskDispatcher saturated =
        new InProcessTaskDispatcher(fullExecutor, scheduler, processor, Duration.ofSeconds(5));

    assertThatThrownBy(() -> saturated.enqueue(PipelineStage.TRANSCRIBE, "m1"))
        .isInstanceOf(DispatchException.class)
        .hasMessageContaining("Worker queue full");
  }
}
