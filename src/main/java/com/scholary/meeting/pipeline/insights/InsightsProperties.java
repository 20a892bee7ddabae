package com.scholary.meeting.pipeline.insights;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for insight extraction.
 *
 * <p>Transcripts shorter than {@code minTranscriptChars} are not analyzed. Prompts include at most
 * {@code promptCharLimit} characters of transcript.
 */
@ConfigurationProperties(prefix = "insights")
@Validated
public record InsightsProperties(
    @Positive int minTranscriptChars,
    @Positive int promptCharLimit,
    @Positive int maxActionItems,
    @Valid @NotNull Llm llm) {

  /** An OpenAI-compatible chat-completions endpoint. Timeouts in seconds. */
  public record Llm(
      boolean enabled,
      String baseUrl,
      String apiKey,
      String model,
      @Positive int connectTimeout,
      @Positive int readTimeout) {

    public boolean isConfigured() {
      return enabled && baseUrl != null && !baseUrl.isBlank() && model != null && !model.isBlank();
    }
  }
}
