package com.scholary.meeting.pipeline.whisper;

/** Turns an audio reference into text with time-aligned segments. */
public interface SpeechTranscriber {

  /**
   * Transcribe the recording at {@code audioReference}.
   *
   * @param audioReference {@code s3://bucket/key} or a key in the default bucket
   * @throws AudioNotFoundException if the reference does not resolve to a recording
   * @throws RuntimeException for any failure that may succeed on retry
   */
  TranscriptionResult transcribe(String audioReference);
}
