package com.scholary.meeting.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.pipeline.insights.DegradingInsightExtractor;
import com.scholary.meeting.pipeline.insights.HeuristicInsightExtractor;
import com.scholary.meeting.pipeline.insights.InsightExtractor;
import com.scholary.meeting.pipeline.insights.InsightsProperties;
import com.scholary.meeting.pipeline.insights.LlmInsightExtractor;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Insight extraction: the LLM when configured, heuristics otherwise or on failure. */
@Configuration
@EnableConfigurationProperties(InsightsProperties.class)
public class InsightsConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(InsightsConfig.class);

  @Bean
  public InsightExtractor insightExtractor(
      InsightsProperties properties, ObjectMapper objectMapper) {
    Optional<InsightExtractor> primary = Optional.empty();
    if (properties.llm().isConfigured()) {
      primary = Optional.of(new LlmInsightExtractor(properties, objectMapper));
    } else {
      LOGGER.info("No LLM configured for insights, using heuristic extraction");
    }
    return new DegradingInsightExtractor(
        primary,
        new HeuristicInsightExtractor(properties.maxActionItems()),
        properties.minTranscriptChars());
  }
}
