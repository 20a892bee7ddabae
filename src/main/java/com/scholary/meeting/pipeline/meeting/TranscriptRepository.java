package com.scholary.meeting.pipeline.meeting;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Repository;

/** In-memory transcripts keyed by meeting id. Saving replaces any previous transcript. */
@Repository
public class TranscriptRepository {

  private final ConcurrentMap<String, Transcript> transcripts = new ConcurrentHashMap<>();

  public void save(Transcript transcript) {
    transcripts.put(transcript.meetingId(), transcript);
  }

  public Optional<Transcript> findByMeetingId(String meetingId) {
    return Optional.ofNullable(transcripts.get(meetingId));
  }

  public int count() {
    return transcripts.size();
  }
}
