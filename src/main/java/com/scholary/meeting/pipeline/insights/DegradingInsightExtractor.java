package com.scholary.meeting.pipeline.insights;

import com.scholary.meeting.pipeline.meeting.MeetingInsights;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prefers the model-backed extractor and falls back to heuristics when it is not configured or
 * fails. Only a failing fallback fails the stage.
 */
public class DegradingInsightExtractor implements InsightExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(DegradingInsightExtractor.class);

  public static final String TOO_SHORT_SUMMARY = "Meeting transcript too short to summarize.";

  private final Optional<InsightExtractor> primary;
  private final InsightExtractor fallback;
  private final int minTranscriptChars;

  public DegradingInsightExtractor(
      Optional<InsightExtractor> primary, InsightExtractor fallback, int minTranscriptChars) {
    this.primary = primary;
    this.fallback = fallback;
    this.minTranscriptChars = minTranscriptChars;
  }

  @Override
  public MeetingInsights analyze(String transcript) {
    if (transcript == null || transcript.strip().length() < minTranscriptChars) {
      LOGGER.info("Transcript too short for analysis, using placeholder summary");
      return new MeetingInsights(null, TOO_SHORT_SUMMARY, List.of(), List.of());
    }

    if (primary.isPresent()) {
      try {
        return primary.get().analyze(transcript);
      } catch (RuntimeException e) {
        LOGGER.warn("Primary insight extraction failed, using heuristics: {}", e.getMessage());
      }
    }
    return fallback.analyze(transcript);
  }
}
