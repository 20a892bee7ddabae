package com.scholary.meeting.pipeline.deadletter;

/** The dead-letter store could not be written or read. */
public class DeadLetterException extends RuntimeException {

  public DeadLetterException(String message, Throwable cause) {
    super(message, cause);
  }
}
