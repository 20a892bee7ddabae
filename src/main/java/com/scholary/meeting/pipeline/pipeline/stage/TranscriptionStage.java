package com.scholary.meeting.pipeline.pipeline.stage;

import com.scholary.meeting.pipeline.idempotency.IdempotencyGuardFactory;
import com.scholary.meeting.pipeline.meeting.Meeting;
import com.scholary.meeting.pipeline.meeting.MeetingRepository;
import com.scholary.meeting.pipeline.meeting.MeetingStatus;
import com.scholary.meeting.pipeline.meeting.Transcript;
import com.scholary.meeting.pipeline.meeting.TranscriptRepository;
import com.scholary.meeting.pipeline.pipeline.AbstractStageHandler;
import com.scholary.meeting.pipeline.pipeline.PermanentStageException;
import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import com.scholary.meeting.pipeline.whisper.AudioNotFoundException;
import com.scholary.meeting.pipeline.whisper.SpeechTranscriber;
import com.scholary.meeting.pipeline.whisper.TranscriptionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stage 1: speech to text.
 *
 * <p>pending → processing → transcribed. A meeting without audio, or whose audio cannot be found,
 * fails permanently. A meeting that is already past this stage keeps its transcript.
 */
@Component
public class TranscriptionStage extends AbstractStageHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionStage.class);

  private final SpeechTranscriber transcriber;
  private final TranscriptRepository transcriptRepository;

  public TranscriptionStage(
      IdempotencyGuardFactory guards,
      MeetingRepository meetingRepository,
      SpeechTranscriber transcriber,
      TranscriptRepository transcriptRepository) {
    super(guards, meetingRepository);
    this.transcriber = transcriber;
    this.transcriptRepository = transcriptRepository;
  }

  @Override
  public PipelineStage stage() {
    return PipelineStage.TRANSCRIBE;
  }

  @Override
  protected void execute(String meetingId) {
    Meeting meeting =
        requireMeeting(
            meetingId,
            MeetingStatus.PENDING,
            MeetingStatus.PROCESSING,
            MeetingStatus.TRANSCRIBED,
            MeetingStatus.READY);

    if (meeting.status() == MeetingStatus.TRANSCRIBED || meeting.status() == MeetingStatus.READY) {
      // late duplicate: the transcript is there, let the chain move on without a second call
      if (transcriptRepository.findByMeetingId(meetingId).isPresent()) {
        LOGGER.info(
            "Transcript already stored, not transcribing again: meetingId={}, status={}",
            meetingId,
            meeting.status().value());
        return;
      }
      throw PermanentStageException.transcriptNotFound(meetingId);
    }

    advanceStatus(meetingId, MeetingStatus.PROCESSING);

    String audio =
        meeting
            .audio()
            .orElseThrow(
                () -> new PermanentStageException("Meeting has no audio file: " + meetingId));

    TranscriptionResult result;
    try {
      result = transcriber.transcribe(audio);
    } catch (AudioNotFoundException e) {
      throw new PermanentStageException(e.getMessage(), e);
    }

    transcriptRepository.save(
        new Transcript(meetingId, result.text(), result.languageCode(), result.segments()));
    meetingRepository.updateDuration(meetingId, result.durationSeconds());

    LOGGER.info(
        "Transcript stored: meetingId={}, chars={}, segments={}, language={}",
        meetingId,
        result.text().length(),
        result.segments().size(),
        result.languageCode());

    advanceStatus(meetingId, MeetingStatus.TRANSCRIBED);
  }
}
