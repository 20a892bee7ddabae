package com.scholary.meeting.pipeline.embedding.chunking;

/**
 * Target chunk size and overlap, both in characters.
 */
public record ChunkingConfig(int chunkSize, int chunkOverlap) {

  public static final ChunkingConfig DEFAULT = new ChunkingConfig(500, 50);

  public ChunkingConfig {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new IllegalArgumentException(
          "chunkOverlap must be in [0, chunkSize): " + chunkOverlap + " vs " + chunkSize);
    }
  }
}
