package com.scholary.meeting.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.pipeline.embedding.EmbeddingGenerator;
import com.scholary.meeting.pipeline.embedding.EmbeddingProperties;
import com.scholary.meeting.pipeline.embedding.HttpEmbeddingClient;
import com.scholary.meeting.pipeline.embedding.chunking.ChunkingConfig;
import com.scholary.meeting.pipeline.embedding.chunking.SegmentGroupingChunkingStrategy;
import com.scholary.meeting.pipeline.embedding.chunking.SentenceBoundaryChunkingStrategy;
import com.scholary.meeting.pipeline.embedding.chunking.TranscriptChunker;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Transcript chunking and the embedding client. */
@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfig {

  @Bean
  public EmbeddingGenerator embeddingGenerator(
      EmbeddingProperties properties, ObjectMapper objectMapper) {
    return new HttpEmbeddingClient(properties, objectMapper);
  }

  @Bean
  public TranscriptChunker transcriptChunker(
      SegmentGroupingChunkingStrategy segmentStrategy,
      SentenceBoundaryChunkingStrategy sentenceStrategy,
      EmbeddingProperties properties) {
    return new TranscriptChunker(
        segmentStrategy,
        sentenceStrategy,
        new ChunkingConfig(properties.chunking().size(), properties.chunking().overlap()));
  }
}
