package com.scholary.meeting.pipeline.meeting;

import java.time.Instant;
import java.util.Optional;

/**
 * A meeting record as seen by the pipeline.
 *
 * <p>The pipeline only reads the id and audio location and writes the status and duration. Records
 * are immutable; the repository swaps whole values.
 */
public record Meeting(
    String id,
    String title,
    String audioLocation, // null until audio is attached
    Double durationSeconds, // null until transcription reports it
    MeetingStatus status,
    Instant createdAt) {

  public static Meeting pending(String id, String title, String audioLocation) {
    return new Meeting(id, title, audioLocation, null, MeetingStatus.PENDING, Instant.now());
  }

  public Optional<String> audio() {
    return Optional.ofNullable(audioLocation).filter(location -> !location.isBlank());
  }

  public Meeting withStatus(MeetingStatus newStatus) {
    return new Meeting(id, title, audioLocation, durationSeconds, newStatus, createdAt);
  }

  public Meeting withDuration(double seconds) {
    return new Meeting(id, title, audioLocation, seconds, status, createdAt);
  }
}
