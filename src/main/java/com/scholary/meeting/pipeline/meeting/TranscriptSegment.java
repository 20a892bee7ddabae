package com.scholary.meeting.pipeline.meeting;

/**
 * A time-aligned span of the transcript.
 *
 * <p>Speaker is null unless diarization labeled the segment.
 */
public record TranscriptSegment(double start, double end, String text, String speaker) {

  public TranscriptSegment(double start, double end, String text) {
    this(start, end, text, null);
  }

  public TranscriptSegment withSpeaker(String label) {
    return new TranscriptSegment(start, end, text, label);
  }
}
