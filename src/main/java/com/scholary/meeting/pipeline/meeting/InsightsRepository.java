package com.scholary.meeting.pipeline.meeting;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Repository;

/** In-memory meeting insights keyed by meeting id. Saving replaces any previous insights. */
@Repository
public class InsightsRepository {

  private final ConcurrentMap<String, MeetingInsights> insights = new ConcurrentHashMap<>();

  public void save(MeetingInsights meetingInsights) {
    insights.put(meetingInsights.meetingId(), meetingInsights);
  }

  public Optional<MeetingInsights> findByMeetingId(String meetingId) {
    return Optional.ofNullable(insights.get(meetingId));
  }

  public int count() {
    return insights.size();
  }
}
