package com.scholary.meeting.pipeline.embedding;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the embedding service and transcript chunking.
 *
 * <p>The default dimension matches all-MiniLM-L6-v2. Timeouts in seconds, chunk sizes in
 * characters.
 */
@ConfigurationProperties(prefix = "embedding")
@Validated
public record EmbeddingProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int dimension,
    @Positive int batchSize,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Valid @NotNull Chunking chunking) {

  public record Chunking(@Positive int size, @PositiveOrZero int overlap) {}
}
