package com.scholary.meeting.pipeline.objectstore;

/** The requested bucket/key does not exist. Retrying will not help. */
public class ObjectNotFoundException extends ObjectStoreException {

  public ObjectNotFoundException(String bucket, String key, Throwable cause) {
    super(String.format("Object not found: bucket=%s, key=%s", bucket, key), cause);
  }
}
