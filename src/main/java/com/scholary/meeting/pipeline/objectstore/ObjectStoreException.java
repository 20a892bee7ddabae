package com.scholary.meeting.pipeline.objectstore;

/** Thrown when an object storage operation fails. Usually worth retrying. */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
