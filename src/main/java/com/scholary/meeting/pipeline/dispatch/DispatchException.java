package com.scholary.meeting.pipeline.dispatch;

/** A task could not be handed to the transport (queue full, broker down). */
public class DispatchException extends RuntimeException {

  public DispatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
