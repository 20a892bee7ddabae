package com.scholary.meeting.pipeline.diarization;

import java.nio.file.Path;
import java.util.List;

/** Used when {@code diarization.enabled} is false. Never labels anything. */
public class DisabledSpeakerDiarizer implements SpeakerDiarizer {

  @Override
  public List<SpeakerTurn> diarize(Path audioFile) {
    return List.of();
  }

  @Override
  public boolean isEnabled() {
    return false;
  }
}
