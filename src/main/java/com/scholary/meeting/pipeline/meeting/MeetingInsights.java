package com.scholary.meeting.pipeline.meeting;

import java.util.List;

/** Output of the insight stage: summary, action items and key topics. */
public record MeetingInsights(
    String meetingId, String summary, List<ActionItem> actionItems, List<String> topics) {

  public MeetingInsights {
    actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
    topics = topics == null ? List.of() : List.copyOf(topics);
  }

  /** Same insights attributed to another meeting id. */
  public MeetingInsights forMeeting(String id) {
    return new MeetingInsights(id, summary, actionItems, topics);
  }
}
