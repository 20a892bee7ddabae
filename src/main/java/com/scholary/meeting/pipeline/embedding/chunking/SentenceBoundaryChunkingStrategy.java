package com.scholary.meeting.pipeline.embedding.chunking;

import com.scholary.meeting.pipeline.meeting.Transcript;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fixed-size character windows with overlap, cut at a sentence boundary when one is available.
 *
 * <p>A window of {@code chunkSize} characters is shortened to end just after the last ". ", "? ",
 * "! " or newline found in its second half, tried in that order. The next window starts {@code
 * chunkOverlap} characters before the previous one ended.
 *
 * <pre>
 * size 500, overlap 50, sentence end at 430:
 * Chunk 0: [0, 431)
 * Chunk 1: [381, ...)
 * </pre>
 */
@Component
public class SentenceBoundaryChunkingStrategy implements TextChunkingStrategy {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(SentenceBoundaryChunkingStrategy.class);

  private static final List<String> BOUNDARIES = List.of(". ", "? ", "! ", "\n");

  @Override
  public List<TextChunk> chunk(Transcript transcript, ChunkingConfig config) {
    return chunkText(transcript.text(), config);
  }

  public List<TextChunk> chunkText(String text, ChunkingConfig config) {
    List<TextChunk> chunks = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return chunks;
    }

    int size = config.chunkSize();
    int length = text.length();
    int start = 0;

    while (start < length) {
      int end = start + size;

      if (end < length) {
        int searchFloor = start + size / 2;
        for (String boundary : BOUNDARIES) {
          int last = text.lastIndexOf(boundary, end - boundary.length());
          if (last >= searchFloor) {
            end = last + 1;
            break;
          }
        }
      } else {
        end = length;
      }

      String chunkText = text.substring(start, end).strip();
      if (!chunkText.isEmpty()) {
        chunks.add(TextChunk.untimed(chunks.size(), chunkText));
      }

      if (end >= length) {
        break;
      }
      start = Math.max(end - config.chunkOverlap(), start + 1);
    }

    LOGGER.debug("Created {} sentence-boundary chunks from {} chars", chunks.size(), length);
    return chunks;
  }

  @Override
  public String getStrategyName() {
    return "sentence-boundary";
  }
}
