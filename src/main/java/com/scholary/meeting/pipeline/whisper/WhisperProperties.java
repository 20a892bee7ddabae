package com.scholary.meeting.pipeline.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the faster-whisper API client.
 *
 * <p>Timeouts are in seconds. {@code language} forces the transcription language; leave it empty
 * to let the service detect it. Retries are not configured here: a failed call fails the stage,
 * and the pipeline retries the stage.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    String language,
    @NotBlank String tempDir) {

  public boolean hasForcedLanguage() {
    return language != null && !language.isBlank();
  }
}
