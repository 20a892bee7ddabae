package com.scholary.meeting.pipeline.embedding.chunking;

import com.scholary.meeting.pipeline.meeting.Transcript;
import java.util.List;

/**
 * Strategy interface for splitting a transcript into overlapping chunks.
 *
 * <ul>
 *   <li>Sentence boundary: character windows cut at the nearest sentence end
 *   <li>Segment grouping: whole time-aligned segments, so chunks keep their timings
 * </ul>
 */
public interface TextChunkingStrategy {

  /**
   * Split the transcript. Chunks are numbered from zero and never empty.
   *
   * @param transcript the transcript to split
   * @param config size and overlap
   * @return chunks in transcript order
   */
  List<TextChunk> chunk(Transcript transcript, ChunkingConfig config);

  /**
   * Get the strategy name for logging and debugging.
   *
   * @return strategy name
   */
  String getStrategyName();
}
