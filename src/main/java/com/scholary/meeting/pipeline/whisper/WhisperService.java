package com.scholary.meeting.pipeline.whisper;

import java.nio.file.Path;

/**
 * Speech-to-text over a local audio file.
 *
 * <p>Lets the transcriber be tested without an HTTP endpoint.
 */
public interface WhisperService {

  /**
   * Transcribe a whole recording in one request.
   *
   * @param audioFile the audio file to transcribe
   * @return the transcription response
   * @throws WhisperException if the call fails
   */
  WhisperResponse transcribe(Path audioFile);
}
