package com.scholary.meeting.pipeline.diarization;

/** The diarization service could not be reached or returned garbage. */
public class DiarizationException extends RuntimeException {

  public DiarizationException(String message) {
    super(message);
  }

  public DiarizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
