package com.scholary.meeting.pipeline.embedding.chunking;

import com.scholary.meeting.pipeline.meeting.Transcript;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks a chunking strategy per transcript: segment grouping when any time-aligned segment carries
 * text, sentence boundaries over the full text otherwise. A transcript with neither has no chunks.
 */
public class TranscriptChunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptChunker.class);

  private final TextChunkingStrategy segmentStrategy;
  private final TextChunkingStrategy textStrategy;
  private final ChunkingConfig config;

  public TranscriptChunker(
      TextChunkingStrategy segmentStrategy,
      TextChunkingStrategy textStrategy,
      ChunkingConfig config) {
    this.segmentStrategy = segmentStrategy;
    this.textStrategy = textStrategy;
    this.config = config;
  }

  public List<TextChunk> chunk(Transcript transcript) {
    TextChunkingStrategy strategy;
    if (hasSegmentText(transcript)) {
      strategy = segmentStrategy;
    } else if (transcript.text() != null && !transcript.text().isBlank()) {
      strategy = textStrategy;
    } else {
      return List.of();
    }
    List<TextChunk> chunks = strategy.chunk(transcript, config);

    LOGGER.info(
        "Chunked transcript: meetingId={}, strategy={}, chunks={}",
        transcript.meetingId(),
        strategy.getStrategyName(),
        chunks.size());
    return chunks;
  }

  private static boolean hasSegmentText(Transcript transcript) {
    return transcript.segments().stream()
        .anyMatch(segment -> segment.text() != null && !segment.text().isBlank());
  }
}
