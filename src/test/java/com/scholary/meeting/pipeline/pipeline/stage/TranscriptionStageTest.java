package com.scholary.meeting.pipeline.pipeline.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.meeting.pipeline.idempotency.IdempotencyGuardFactory;
import com.scholary.meeting.pipeline.meeting.Meeting;
import com.scholary.meeting.pipeline.meeting.MeetingRepository;
import com.scholary.meeting.pipeline.meeting.MeetingStatus;
import com.scholary.meeting.pipeline.meeting.Transcript;
import com.scholary.meeting.pipeline.meeting.TranscriptRepository;
import com.scholary.meeting.pipeline.meeting.TranscriptSegment;
import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import com.scholary.meeting.pipeline.pipeline.StageOutcome;
import com.scholary.meeting.pipeline.whisper.AudioNotFoundException;
import com.scholary.meeting.pipeline.whisper.SpeechTranscriber;
import com.scholary.meeting.pipeline.whisper.TranscriptionResult;
import com.scholary.meeting.pipeline.whisper.WhisperException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptionStageTest {

  @Mock private SpeechTranscriber transcriber;

  private MeetingRepository meetingRepository;
  private TranscriptRepository transcriptRepository;
  private IdempotencyGuardFactory guards;
  private TranscriptionStage stage;

  @BeforeEach
  void setUp() {
    meetingRepository = new MeetingRepository();
    transcriptRepository = new TranscriptRepository();
    guards = StageFixtures.guards();
    stage = new TranscriptionStage(guards, meetingRepository, transcriber, transcriptRepository);
  }

  @Test
  void handle_shouldStoreTranscriptAndAdvanceStatus() {
    StageFixtures.saveMeeting(meetingRepository, "m1", MeetingStatus.PENDING);
    when(transcriber.transcribe("s3://meetings/m1.mp3"))
        .thenReturn(
            new TranscriptionResult(
                "hello world", "en", 1.5, List.of(new TranscriptSegment(0.0, 1.5, "hello world"))));

    StageOutcome outcome = stage.handle("m1");

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.COMPLETED);
    Meeting meeting = meetingRepository.findById("m1").get();
    assertThat(meeting.status()).isEqualTo(MeetingStatus.TRANSCRIBED);
    assertThat(meeting.durationSeconds()).isEqualTo(1.5);
    assertThat(transcriptRepository.findByMeetingId("m1"))
        .get()
        .extracting(Transcript::text)
        .isEqualTo("hello world");
  }

  @Test
  void duplicateDelivery_shouldNotCallTranscriberAgain() {
    StageFixtures.saveMeeting(meetingRepository, "m1", MeetingStatus.PENDING);
    when(transcriber.transcribe(anyString()))
        .thenReturn(new TranscriptionResult("hello", "en", 1.0, List.of()));

    stage.handle("m1");
    StageOutcome duplicate = stage.handle("m1");

    assertThat(duplicate.type()).isEqualTo(StageOutcome.Type.ALREADY_COMPLETED);
    assertThat(duplicate.chainsToNext()).isTrue();
    verify(transcriber, times(1)).transcribe(anyString());
  }

  @Test
  void lockHeldElsewhere_shouldReportInFlight() {
    StageFixtures.saveMeeting(meetingRepository, "m1", MeetingStatus.PROCESSING);
    guards.forStage(PipelineStage.TRANSCRIBE, "m1").acquire();

    StageOutcome outcome = stage.handle("m1");

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.IN_FLIGHT);
    assertThat(outcome.chainsToNext()).isFalse();
    verify(transcriber, never()).transcribe(anyString());
  }

  @Test
  void missingMeeting_shouldFailPermanently() {
    StageOutcome outcome = stage.handle("missing");

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.PERMANENT_FAILURE);
    assertThat(outcome.reason()).contains("Meeting not found");
  }

  @Test
  void meetingWithoutAudio_shouldFailPermanently() {
    meetingRepository.save(
        new Meeting("m1", "No audio", null, null, MeetingStatus.PENDING, Instant.now()));

    StageOutcome outcome = stage.handle("m1");

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.PERMANENT_FAILURE);
    verify(transcriber, never()).transcribe(anyString());
  }

  @Test
  void missingAudioObject_shouldFailPermanently() {
    StageFixtures.saveMeeting(meetingRepository, "m1", MeetingStatus.PENDING);
    when(transcriber.transcribe(anyString()))
        .thenThrow(new AudioNotFoundException("Audio not found: s3://meetings/m1.mp3"));

    StageOutcome outcome = stage.handle("m1");

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.PERMANENT_FAILURE);
  }

  @Test
  void transcriberFailure_shouldBeTransientAndReleaseLock() {
    StageFixtures.saveMeeting(meetingRepository, "m1", MeetingStatus.PENDING);
    when(transcriber.transcribe(anyString()))
        .thenThrow(new WhisperException("Whisper returned 503"))
        .thenReturn(new TranscriptionResult("hello", "en", 1.0, List.of()));

    StageOutcome first = stage.handle("m1");
    StageOutcome retry = stage.handle("m1");

    assertThat(first.type()).isEqualTo(StageOutcome.Type.TRANSIENT_FAILURE);
    assertThat(first.reason()).contains("Whisper returned 503");
    assertThat(retry.type()).isEqualTo(StageOutcome.Type.COMPLETED);
    assertThat(meetingRepository.findById("m1").get().status())
        .isEqualTo(MeetingStatus.TRANSCRIBED);
  }

  @Test
  void lateDuplicate_withStoredTranscript_shouldCompleteWithoutTranscribing() {
    StageFixtures.saveMeeting(meetingRepository, "m1", MeetingStatus.READY);
    transcriptRepository.save(new Transcript("m1", "hello", "en", List.of()));

    StageOutcome outcome = stage.handle("m1");

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.COMPLETED);
    assertThat(meetingRepository.findById("m1").get().status()).isEqualTo(MeetingStatus.READY);
    verify(transcriber, never()).transcribe(anyString());
  }

  @Test
  void lateDuplicate_withoutTranscript_shouldFailPermanently() {
    StageFixtures.saveMeeting(meetingRepository, "m1", MeetingStatus.TRANSCRIBED);

    StageOutcome outcome = stage.handle("m1");

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.PERMANENT_FAILURE);
  }

  @Test
  void erroredMeeting_shouldFailPermanently() {
    StageFixtures.saveMeeting(meetingRepository, "m1", MeetingStatus.ERROR);

    StageOutcome outcome = stage.handle("m1");

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.PERMANENT_FAILURE);
  }
}
