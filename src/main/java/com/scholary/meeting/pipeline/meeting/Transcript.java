package com.scholary.meeting.pipeline.meeting;

import java.util.List;

/** Output of the transcription stage, one per meeting. */
public record Transcript(
    String meetingId, String text, String languageCode, List<TranscriptSegment> segments) {

  public Transcript {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }
}
