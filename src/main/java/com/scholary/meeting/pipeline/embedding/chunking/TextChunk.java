package com.scholary.meeting.pipeline.embedding.chunking;

/**
 * A span of transcript text ready for embedding.
 *
 * <p>Times are null when the chunk was cut from plain text.
 */
public record TextChunk(int index, String text, Double startTime, Double endTime) {

  public static TextChunk untimed(int index, String text) {
    return new TextChunk(index, text, null, null);
  }
}
