package com.scholary.meeting.pipeline.whisper;

/** The audio reference does not resolve to a stored recording. */
public class AudioNotFoundException extends RuntimeException {

  public AudioNotFoundException(String message) {
    super(message);
  }

  public AudioNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
