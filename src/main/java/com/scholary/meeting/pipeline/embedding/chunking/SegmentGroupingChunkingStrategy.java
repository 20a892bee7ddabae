package com.scholary.meeting.pipeline.embedding.chunking;

import com.scholary.meeting.pipeline.meeting.Transcript;
import com.scholary.meeting.pipeline.meeting.TranscriptSegment;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Groups whole transcript segments into chunks of roughly {@code chunkSize} characters.
 *
 * <p>A chunk is emitted when the next segment would push it past the target. The following chunk
 * starts with the trailing segments of the previous one whose lengths, plus one separator each,
 * fit within {@code chunkOverlap}. Each chunk spans from its first segment's start to its last
 * segment's end.
 */
@Component
public class SegmentGroupingChunkingStrategy implements TextChunkingStrategy {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(SegmentGroupingChunkingStrategy.class);

  @Override
  public List<TextChunk> chunk(Transcript transcript, ChunkingConfig config) {
    return chunkSegments(transcript.segments(), config);
  }

  public List<TextChunk> chunkSegments(List<TranscriptSegment> segments, ChunkingConfig config) {
    List<TextChunk> chunks = new ArrayList<>();
    List<TranscriptSegment> current = new ArrayList<>();
    int currentSize = 0;

    for (TranscriptSegment segment : segments) {
      String text = segment.text() == null ? "" : segment.text().strip();
      if (text.isEmpty()) {
        continue;
      }

      if (currentSize + text.length() > config.chunkSize() && !current.isEmpty()) {
        chunks.add(toChunk(chunks.size(), current));

        List<TranscriptSegment> carried = new ArrayList<>();
        int carriedChars = 0;
        for (int i = current.size() - 1; i >= 0; i--) {
          int withSeparator = current.get(i).text().length() + 1;
          if (carriedChars + withSeparator > config.chunkOverlap()) {
            break;
          }
          carried.add(0, current.get(i));
          carriedChars += withSeparator;
        }
        current = carried;
        currentSize = carriedChars;
      }

      current.add(new TranscriptSegment(segment.start(), segment.end(), text, segment.speaker()));
      currentSize += text.length() + 1;
    }

    if (!current.isEmpty()) {
      chunks.add(toChunk(chunks.size(), current));
    }

    LOGGER.debug(
        "Created {} segment chunks from {} segments (overlap={})",
        chunks.size(),
        segments.size(),
        config.chunkOverlap());
    return chunks;
  }

  private static TextChunk toChunk(int index, List<TranscriptSegment> segments) {
    String text = segments.stream().map(TranscriptSegment::text).collect(Collectors.joining(" "));
    return new TextChunk(
        index, text, segments.get(0).start(), segments.get(segments.size() - 1).end());
  }

  @Override
  public String getStrategyName() {
    return "segment-grouping";
  }
}
