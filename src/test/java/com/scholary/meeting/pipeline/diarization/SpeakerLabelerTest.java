package com.scholary.meeting.pipeline.diarization;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.meeting.pipeline.meeting.TranscriptSegment;
import java.util.List;
import org.junit.jupiter.api.Test;

class SpeakerLabelerTest {

  private final SpeakerLabeler labeler = new SpeakerLabeler();

  @Test
  void picksSpeakerWithLongestOverlap() {
    List<TranscriptSegment> segments =
        List.of(new TranscriptSegment(0.0, 4.0, "hello"), new TranscriptSegment(4.0, 10.0, "bye"));
    List<SpeakerTurn> turns =
        List.of(
            new SpeakerTurn("SPEAKER_00", 0.0, 5.0),
            new SpeakerTurn("SPEAKER_01", 5.0, 10.0));

    List<TranscriptSegment> labeled = labeler.label(segments, turns);

    assertThat(labeled).extracting(TranscriptSegment::speaker)
        .containsExactly("SPEAKER_00", "SPEAKER_01");
    assertThat(labeled.get(1).text()).isEqualTo("bye");
  }

  @Test
  void segmentWithoutOverlapKeepsNullSpeaker() {
    List<TranscriptSegment> segments = List.of(new TranscriptSegment(20.0, 22.0, "late"));

    List<TranscriptSegment> labeled =
        labeler.label(segments, List.of(new SpeakerTurn("SPEAKER_00", 0.0, 5.0)));

    assertThat(labeled.get(0).speaker()).isNull();
  }

  @Test
  void noTurnsReturnsSegmentsUnchanged() {
    List<TranscriptSegment> segments = List.of(new TranscriptSegment(0.0, 1.0, "hi"));

    assertThat(labeler.label(segments, List.of())).isSameAs(segments);
    assertThat(labeler.label(segments, null)).isSameAs(segments);
  }
}
