package com.scholary.meeting.pipeline.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response from the Whisper transcription API.
 *
 * <p>{@code text} and {@code duration} are optional; older service versions only send segments and
 * the detected language.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(
    List<WhisperSegment> segments, String language, String text, Double duration) {

  public WhisperResponse {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }
}
