package com.scholary.meeting.pipeline.whisper;

/**
 * Exception thrown when Whisper API calls fail.
 *
 * <p>Network issues, service unavailability or unparseable responses. The stage is retried.
 */
public class WhisperException extends RuntimeException {

  public WhisperException(String message) {
    super(message);
  }

  public WhisperException(String message, Throwable cause) {
    super(message, cause);
  }
}
