package com.scholary.meeting.pipeline.diarization;

import java.nio.file.Path;
import java.util.List;

/** Finds who spoke when in a recording. */
public interface SpeakerDiarizer {

  /**
   * Diarize a local audio file.
   *
   * @return speaker turns sorted by start time; empty when diarization is not available
   * @throws DiarizationException if the diarization service fails
   */
  List<SpeakerTurn> diarize(Path audioFile);

  boolean isEnabled();
}
