package com.scholary.meeting.pipeline.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.meeting.pipeline.deadletter.DeadLetterRecord;
import com.scholary.meeting.pipeline.deadletter.InMemoryDeadLetterRecorder;
import com.scholary.meeting.pipeline.deadletter.PipelineFailureHandler;
import com.scholary.meeting.pipeline.meeting.Meeting;
import com.scholary.meeting.pipeline.meeting.MeetingRepository;
import com.scholary.meeting.pipeline.meeting.MeetingStatus;
import com.scholary.meeting.pipeline.pipeline.PipelineGraph;
import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import com.scholary.meeting.pipeline.pipeline.StageHandler;
import com.scholary.meeting.pipeline.pipeline.StageOutcome;
import com.scholary.meeting.pipeline.retry.BackoffPolicy;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class TaskProcessorTest {

  @Mock private TaskDispatcher dispatcher;

  private StageHandler transcribe;
  private StageHandler insights;
  private StageHandler embeddings;
  private MeetingRepository meetingRepository;
  private InMemoryDeadLetterRecorder recorder;
  private ThreadPoolTaskExecutor stageExecutor;
  private TaskProcessor processor;

  @BeforeEach
  void setUp() {
    transcribe = handler(PipelineStage.TRANSCRIBE);
    insights = handler(PipelineStage.INSIGHTS);
    embeddings = handler(PipelineStage.EMBEDDINGS);

    meetingRepository = new MeetingRepository();
    meetingRepository.save(Meeting.pending("m1", "Retro", "s3://meetings/m1.mp3"));
    meetingRepository.transition("m1", MeetingStatus.PROCESSING);
    meetingRepository.transition("m1", MeetingStatus.TRANSCRIBED);
    recorder = new InMemoryDeadLetterRecorder(100);

    stageExecutor = new ThreadPoolTaskExecutor();
    stageExecutor.setCorePoolSize(2);
    stageExecutor.initialize();

    processor =
        new TaskProcessor(
            List.of(transcribe, insights, embeddings),
            PipelineGraph.standard(),
            new BackoffPolicy(Duration.ofSeconds(10), Duration.ofSeconds(600), 3),
            new StageTimeLimiter(stageExecutor, Duration.ofSeconds(5), Duration.ofSeconds(10)),
            new PipelineFailureHandler(recorder, meetingRepository));
  }

  @AfterEach
  void tearDown() {
    stageExecutor.shutdown();
  }

  @Test
  void decide_completedStage_shouldChainToNext() {
    TaskDisposition disposition =
        processor.decide(
            TaskMessage.first(PipelineStage.TRANSCRIBE, "m1"), StageOutcome.completed());

    assertThat(disposition.action()).isEqualTo(TaskDisposition.Action.ACK_AND_CHAIN);
    assertThat(disposition.nextStage()).isEqualTo(PipelineStage.INSIGHTS);
  }

  @Test
  void decide_lastStage_shouldOnlyAck() {
    TaskDisposition disposition =
        processor.decide(
            TaskMessage.first(PipelineStage.EMBEDDINGS, "m1"), StageOutcome.completed());

    assertThat(disposition.action()).isEqualTo(TaskDisposition.Action.ACK);
    assertThat(disposition.nextStage()).isNull();
  }

  @Test
  void decide_alreadyCompleted_shouldStillChain() {
    TaskDisposition disposition =
        processor.decide(
            TaskMessage.first(PipelineStage.INSIGHTS, "m1"), StageOutcome.alreadyCompleted());

    assertThat(disposition).isEqualTo(TaskDisposition.ackAndChain(PipelineStage.EMBEDDINGS));
  }

  @Test
  void decide_inFlight_shouldAckWithoutChaining() {
    TaskDisposition disposition =
        processor.decide(TaskMessage.first(PipelineStage.TRANSCRIBE, "m1"), StageOutcome.inFlight());

    assertThat(disposition).isEqualTo(TaskDisposition.ack());
  }

  @Test
  void decide_transientFailure_shouldRetryWithBackoff() {
    StageOutcome failure = StageOutcome.transientFailure("timeout", null);

    assertThat(processor.decide(message(PipelineStage.INSIGHTS, 0), failure).retryDelay())
        .isEqualTo(Duration.ofSeconds(10));
    assertThat(processor.decide(message(PipelineStage.INSIGHTS, 2), failure).retryDelay())
        .isEqualTo(Duration.ofSeconds(40));
    assertThat(processor.decide(message(PipelineStage.INSIGHTS, 3), failure).action())
        .isEqualTo(TaskDisposition.Action.DEAD_LETTER);
  }

  @Test
  void decide_permanentFailure_shouldDeadLetterImmediately() {
    TaskDisposition disposition =
        processor.decide(
            message(PipelineStage.TRANSCRIBE, 0),
            StageOutcome.permanentFailure("Meeting not found: m1", null));

    assertThat(disposition.action()).isEqualTo(TaskDisposition.Action.DEAD_LETTER);
  }

  @Test
  void process_completedStage_shouldEnqueueNextStage() {
    when(transcribe.handle("m1")).thenReturn(StageOutcome.completed());

    processor.process(TaskMessage.first(PipelineStage.TRANSCRIBE, "m1"), dispatcher);

    verify(dispatcher).enqueue(PipelineStage.INSIGHTS, "m1");
    verify(dispatcher, never()).redeliver(any(), any());
  }

  @Test
  void process_inFlight_shouldNotEnqueueAnything() {
    when(insights.handle("m1")).thenReturn(StageOutcome.inFlight());

    processor.process(TaskMessage.first(PipelineStage.INSIGHTS, "m1"), dispatcher);

    verify(dispatcher, never()).enqueue(any(), any());
  }

  @Test
  void process_transientFailure_shouldRedeliverNextAttempt() {
    when(insights.handle("m1")).thenReturn(StageOutcome.transientFailure("LLM timeout", null));
    TaskMessage message = message(PipelineStage.INSIGHTS, 1);

    processor.process(message, dispatcher);

    verify(dispatcher).redeliver(message.nextAttempt(), Duration.ofSeconds(20));
    assertThat(recorder.size()).isZero();
    assertThat(meetingRepository.findById("m1").get().status())
        .isEqualTo(MeetingStatus.TRANSCRIBED);
  }

  @Test
  void process_alwaysFailing_shouldDeadLetterExactlyOnceAfterRetries() {
    when(insights.handle("m1"))
        .thenReturn(StageOutcome.transientFailure("LLM timeout", new IllegalStateException("boom")));

    TaskMessage message = TaskMessage.first(PipelineStage.INSIGHTS, "m1");
    for (int attempt = 0; attempt <= 3; attempt++) {
      processor.process(message, dispatcher);
      message = message.nextAttempt();
    }

    verify(insights, times(4)).handle("m1");
    verify(dispatcher, times(3)).redeliver(any(), any());
    verify(dispatcher, times(1)).deadLetter(any(), any());
    assertThat(recorder.size()).isEqualTo(1);

    DeadLetterRecord deadLetter = recorder.recent(1).get(0);
    assertThat(deadLetter.stageName()).isEqualTo("insights");
    assertThat(deadLetter.meetingId()).isEqualTo("m1");
    assertThat(deadLetter.attempt()).isEqualTo(3);
    assertThat(deadLetter.error()).isEqualTo("LLM timeout");
    assertThat(deadLetter.traceback()).contains("IllegalStateException: boom");
    assertThat(meetingRepository.findById("m1").get().status()).isEqualTo(MeetingStatus.ERROR);
  }

  @Test
  void process_stageOverHardLimit_shouldDeadLetterAndMarkError() throws Exception {
    ThreadPoolTaskExecutor slowExecutor = new ThreadPoolTaskExecutor();
    slowExecutor.setCorePoolSize(1);
    slowExecutor.initialize();
    AtomicBoolean stop = new AtomicBoolean(false);
    CountDownLatch finished = new CountDownLatch(1);
    when(insights.handle("m1"))
        .thenAnswer(
            invocation -> {
              while (!stop.get()) {
                Thread.onSpinWait();
              }
              finished.countDown();
              return StageOutcome.completed();
            });
    TaskProcessor limited =
        new TaskProcessor(
            List.of(transcribe, insights, embeddings),
            PipelineGraph.standard(),
            new BackoffPolicy(Duration.ofSeconds(10), Duration.ofSeconds(600), 3),
            new StageTimeLimiter(slowExecutor, Duration.ofMillis(50), Duration.ofMillis(150)),
            new PipelineFailureHandler(recorder, meetingRepository));

    try {
      TaskDisposition disposition =
          limited.process(TaskMessage.first(PipelineStage.INSIGHTS, "m1"), dispatcher);

      assertThat(disposition.action()).isEqualTo(TaskDisposition.Action.DEAD_LETTER);
      verify(dispatcher, never()).redeliver(any(), any());
      verify(dispatcher).deadLetter(any(), any());
      assertThat(recorder.recent(1).get(0).error()).contains("hard time limit");
      assertThat(meetingRepository.findById("m1").get().status())
          .isEqualTo(MeetingStatus.ERROR);
    } finally {
      stop.set(true);
      assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
      slowExecutor.shutdown();
    }
    verify(dispatcher, never()).enqueue(any(), any());
  }

  @Test
  void process_handlerThrowing_shouldBeTreatedAsTransient() {
    when(embeddings.handle("m1")).thenThrow(new IllegalStateException("unexpected"));

    TaskDisposition disposition =
        processor.process(TaskMessage.first(PipelineStage.EMBEDDINGS, "m1"), dispatcher);

    assertThat(disposition.action()).isEqualTo(TaskDisposition.Action.RETRY);
  }

  @Test
  void process_publishFailure_shouldPropagate() {
    when(transcribe.handle("m1")).thenReturn(StageOutcome.completed());
    doThrow(new DispatchException("broker down", null))
        .when(dispatcher)
        .enqueue(eq(PipelineStage.INSIGHTS), eq("m1"));

    assertThatThrownBy(
            () -> processor.process(TaskMessage.first(PipelineStage.TRANSCRIBE, "m1"), dispatcher))
        .isInstanceOf(DispatchException.class);
  }

  @Test
  void process_shouldClearTaskContextAfterwards() {
    when(transcribe.handle("m1")).thenReturn(StageOutcome.completed());

    processor.process(TaskMessage.first(PipelineStage.TRANSCRIBE, "m1"), dispatcher);

    assertThat(MDC.get("meetingId")).isNull();
    assertThat(MDC.get("taskId")).isNull();
  }

  @Test
  void constructor_shouldRejectMissingHandler() {
    assertThatThrownBy(
            () ->
                new TaskProcessor(
                    List.of(transcribe, insights),
                    PipelineGraph.standard(),
                    new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 0),
                    new StageTimeLimiter(stageExecutor, Duration.ofSeconds(1), Duration.ofSeconds(1)),
                    new PipelineFailureHandler(recorder, meetingRepository)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("EMBEDDINGS");
  }

  private static StageHandler handler(PipelineStage stage) {
    StageHandler handler = mock(StageHandler.class);
    when(handler.stage()).thenReturn(stage);
    return handler;
  }

  private static TaskMessage message(PipelineStage stage, int attempt) {
    return new TaskMessage("task-1", stage, "m1", attempt);
  }
}
