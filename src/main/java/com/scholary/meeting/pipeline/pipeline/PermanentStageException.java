package com.scholary.meeting.pipeline.pipeline;

/**
 * Thrown by a stage when retrying cannot succeed.
 *
 * <p>Typical causes: the meeting or its transcript does not exist, the meeting is in a status the
 * stage cannot start from, or the audio reference points nowhere.
 */
public class PermanentStageException extends RuntimeException {

  public PermanentStageException(String message) {
    super(message);
  }

  public PermanentStageException(String message, Throwable cause) {
    super(message, cause);
  }

  public static PermanentStageException meetingNotFound(String meetingId) {
    return new PermanentStageException("Meeting not found: " + meetingId);
  }

  public static PermanentStageException transcriptNotFound(String meetingId) {
    return new PermanentStageException("Transcript not found for meeting: " + meetingId);
  }
}
