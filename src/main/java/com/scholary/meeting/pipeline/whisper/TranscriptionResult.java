package com.scholary.meeting.pipeline.whisper;

import com.scholary.meeting.pipeline.meeting.TranscriptSegment;
import java.util.List;

/** What speech recognition produced for one recording. */
public record TranscriptionResult(
    String text, String languageCode, double durationSeconds, List<TranscriptSegment> segments) {

  public TranscriptionResult {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }
}
