package com.scholary.meeting.pipeline.deadletter;

import com.scholary.meeting.pipeline.dispatch.TaskMessage;
import com.scholary.meeting.pipeline.meeting.MeetingRepository;
import com.scholary.meeting.pipeline.meeting.MeetingStatus;
import com.scholary.meeting.pipeline.pipeline.StageOutcome;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs once per abandoned task: writes the dead-letter record and freezes the meeting in ERROR.
 *
 * <p>A meeting that already reached READY stays READY; ERROR is only entered from PROCESSING or
 * TRANSCRIBED.
 */
@Component
public class PipelineFailureHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineFailureHandler.class);

  static final int MAX_TRACEBACK_CHARS = 8000;

  private final DeadLetterRecorder recorder;
  private final MeetingRepository meetingRepository;
  private final Clock clock;

  @Autowired
  public PipelineFailureHandler(DeadLetterRecorder recorder, MeetingRepository meetingRepository) {
    this(recorder, meetingRepository, Clock.systemUTC());
  }

  PipelineFailureHandler(
      DeadLetterRecorder recorder, MeetingRepository meetingRepository, Clock clock) {
    this.recorder = recorder;
    this.meetingRepository = meetingRepository;
    this.clock = clock;
  }

  public void onFailure(TaskMessage message, StageOutcome failure) {
    DeadLetterRecord deadLetter =
        new DeadLetterRecord(
            message.taskId(),
            message.stage().stageName(),
            message.meetingId(),
            message.attempt(),
            failure.reason(),
            traceback(failure.cause()),
            Instant.now(clock));

    try {
      recorder.record(deadLetter);
    } catch (RuntimeException e) {
      LOGGER.error(
          "Could not store dead-letter record: taskId={}, stage={}, meetingId={}",
          message.taskId(),
          message.stage().stageName(),
          message.meetingId(),
          e);
    }

    if (!meetingRepository.transition(message.meetingId(), MeetingStatus.ERROR)) {
      LOGGER.warn(
          "Meeting {} not moved to error after {} failure; status left unchanged",
          message.meetingId(),
          message.stage().stageName());
    }
  }

  static String traceback(Throwable cause) {
    if (cause == null) {
      return null;
    }
    StringWriter out = new StringWriter();
    cause.printStackTrace(new PrintWriter(out));
    String trace = out.toString();
    return trace.length() > MAX_TRACEBACK_CHARS ? trace.substring(0, MAX_TRACEBACK_CHARS) : trace;
  }
}
