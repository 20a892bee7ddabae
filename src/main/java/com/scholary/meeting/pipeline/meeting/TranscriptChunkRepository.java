package com.scholary.meeting.pipeline.meeting;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Repository;

/**
 * In-memory transcript chunks grouped by meeting.
 *
 * <p>A meeting's chunk set is always replaced as a whole, never appended to.
 */
@Repository
public class TranscriptChunkRepository {

  private final ConcurrentMap<String, List<TranscriptChunk>> chunks = new ConcurrentHashMap<>();

  public void replaceAll(String meetingId, List<TranscriptChunk> meetingChunks) {
    chunks.put(meetingId, List.copyOf(meetingChunks));
  }

  public List<TranscriptChunk> findByMeetingId(String meetingId) {
    return chunks.getOrDefault(meetingId, List.of());
  }

  public int countByMeetingId(String meetingId) {
    return findByMeetingId(meetingId).size();
  }
}
