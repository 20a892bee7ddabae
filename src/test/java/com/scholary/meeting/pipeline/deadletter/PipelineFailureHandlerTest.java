package com.scholary.meeting.pipeline.deadletter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.scholary.meeting.pipeline.dispatch.TaskMessage;
import com.scholary.meeting.pipeline.meeting.Meeting;
import com.scholary.meeting.pipeline.meeting.MeetingRepository;
import com.scholary.meeting.pipeline.meeting.MeetingStatus;
import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import com.scholary.meeting.pipeline.pipeline.StageOutcome;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PipelineFailureHandlerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private InMemoryDeadLetterRecorder recorder;
  private MeetingRepository meetings;
  private PipelineFailureHandler handler;

  @BeforeEach
  void setUp() {
    recorder = new InMemoryDeadLetterRecorder(10);
    meetings = new MeetingRepository();
    handler = new PipelineFailureHandler(recorder, meetings, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void recordsDeadLetterAndMovesMeetingToError() {
    save("m1", MeetingStatus.TRANSCRIBED);
    TaskMessage message = new TaskMessage("task-1", PipelineStage.INSIGHTS, "m1", 3);

    handler.onFailure(
        message,
        StageOutcome.transientFailure("LLM timeout", new IllegalStateException("LLM timeout")));

    assertThat(recorder.recent(1))
        .singleElement()
        .satisfies(
            record -> {
              assertThat(record.taskId()).isEqualTo("task-1");
              assertThat(record.stageName()).isEqualTo("insights");
              assertThat(record.meetingId()).isEqualTo("m1");
              assertThat(record.attempt()).isEqualTo(3);
              assertThat(record.error()).isEqualTo("LLM timeout");
              assertThat(record.traceback()).contains("IllegalStateException");
              assertThat(record.timestamp()).isEqualTo(NOW);
            });
    assertThat(meetings.findById("m1")).get().extracting(Meeting::status).isEqualTo(MeetingStatus.ERROR);
  }

  @Test
  void readyMeetingStaysReady() {
    save("m2", MeetingStatus.READY);

    handler.onFailure(
        new TaskMessage("task-2", PipelineStage.EMBEDDINGS, "m2", 0),
        StageOutcome.permanentFailure("bad input", null));

    assertThat(recorder.size()).isEqualTo(1);
    assertThat(recorder.recent(1).get(0).traceback()).isNull();
    assertThat(meetings.findById("m2")).get().extracting(Meeting::status).isEqualTo(MeetingStatus.READY);
  }

  @Test
  void recorderFailureStillMarksMeeting() {
    DeadLetterRecorder broken = mock(DeadLetterRecorder.class);
    doThrow(new DeadLetterException("redis down", null)).when(broken).record(any());
    PipelineFailureHandler failing = new PipelineFailureHandler(broken, meetings);
    save("m3", MeetingStatus.PROCESSING);

    failing.onFailure(
        new TaskMessage("task-3", PipelineStage.TRANSCRIBE, "m3", 3),
        StageOutcome.transientFailure("whisper down", null));

    assertThat(meetings.findById("m3")).get().extracting(Meeting::status).isEqualTo(MeetingStatus.ERROR);
  }

  @Test
  void tracebackIsCapped() {
    Throwable cause = new RuntimeException("x".repeat(PipelineFailureHandler.MAX_TRACEBACK_CHARS * 2));

    assertThat(PipelineFailureHandler.traceback(cause))
        .hasSize(PipelineFailureHandler.MAX_TRACEBACK_CHARS);
  }

  private void save(String id, MeetingStatus status) {
    meetings.save(new Meeting(id, "Retro", "s3://meetings/" + id + ".mp3", null, status, NOW));
  }
}
