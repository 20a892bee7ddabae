package com.scholary.meeting.pipeline.insights;

import com.scholary.meeting.pipeline.meeting.MeetingInsights;

/** Derives a summary, action items and key topics from transcript text. */
public interface InsightExtractor {

  /**
   * Analyze a transcript.
   *
   * <p>The returned insights carry no meeting id; the caller attributes them.
   *
   * @throws InsightExtractionException if the backend fails
   */
  MeetingInsights analyze(String transcript);
}
