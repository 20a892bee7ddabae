package com.scholary.meeting.pipeline.insights;

/** The insight backend failed or returned something unusable. */
public class InsightExtractionException extends RuntimeException {

  public InsightExtractionException(String message) {
    super(message);
  }

  public InsightExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
