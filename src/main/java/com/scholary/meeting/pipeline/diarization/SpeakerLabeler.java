package com.scholary.meeting.pipeline.diarization;

import com.scholary.meeting.pipeline.meeting.TranscriptSegment;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Merges speaker turns into transcript segments.
 *
 * <p>Each segment gets the speaker whose turns overlap it the longest. A segment that overlaps no
 * turn keeps a null speaker.
 */
@Component
public class SpeakerLabeler {

  public List<TranscriptSegment> label(
      List<TranscriptSegment> segments, List<SpeakerTurn> turns) {
    if (turns == null || turns.isEmpty()) {
      return segments;
    }

    List<TranscriptSegment> labeled = new ArrayList<>(segments.size());
    for (TranscriptSegment segment : segments) {
      String bestSpeaker = null;
      double bestOverlap = 0.0;

      for (SpeakerTurn turn : turns) {
        double overlap =
            Math.min(segment.end(), turn.end()) - Math.max(segment.start(), turn.start());
        if (overlap > bestOverlap) {
          bestOverlap = overlap;
          bestSpeaker = turn.speaker();
        }
      }
      labeled.add(segment.withSpeaker(bestSpeaker));
    }
    return labeled;
  }
}
