package com.scholary.meeting.pipeline.pipeline.stage;

import com.scholary.meeting.pipeline.embedding.EmbeddingException;
import com.scholary.meeting.pipeline.embedding.EmbeddingGenerator;
import com.scholary.meeting.pipeline.embedding.chunking.TextChunk;
import com.scholary.meeting.pipeline.embedding.chunking.TranscriptChunker;
import com.scholary.meeting.pipeline.idempotency.IdempotencyGuardFactory;
import com.scholary.meeting.pipeline.meeting.MeetingRepository;
import com.scholary.meeting.pipeline.meeting.MeetingStatus;
import com.scholary.meeting.pipeline.meeting.Transcript;
import com.scholary.meeting.pipeline.meeting.TranscriptChunk;
import com.scholary.meeting.pipeline.meeting.TranscriptChunkRepository;
import com.scholary.meeting.pipeline.meeting.TranscriptRepository;
import com.scholary.meeting.pipeline.pipeline.AbstractStageHandler;
import com.scholary.meeting.pipeline.pipeline.PermanentStageException;
import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stage 3: chunk the transcript, embed every chunk, replace the meeting's chunk set and mark the
 * meeting ready.
 */
@Component
public class EmbeddingsStage extends AbstractStageHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingsStage.class);

  private final TranscriptRepository transcriptRepository;
  private final TranscriptChunkRepository chunkRepository;
  private final TranscriptChunker chunker;
  private final EmbeddingGenerator embeddingGenerator;

  public EmbeddingsStage(
      IdempotencyGuardFactory guards,
      MeetingRepository meetingRepository,
      TranscriptRepository transcriptRepository,
      TranscriptChunkRepository chunkRepository,
      TranscriptChunker chunker,
      EmbeddingGenerator embeddingGenerator) {
    super(guards, meetingRepository);
    this.transcriptRepository = transcriptRepository;
    this.chunkRepository = chunkRepository;
    this.chunker = chunker;
    this.embeddingGenerator = embeddingGenerator;
  }

  @Override
  public PipelineStage stage() {
    return PipelineStage.EMBEDDINGS;
  }

  @Override
  protected void execute(String meetingId) {
    requireMeeting(meetingId, MeetingStatus.TRANSCRIBED, MeetingStatus.READY);
    Transcript transcript =
        transcriptRepository
            .findByMeetingId(meetingId)
            .orElseThrow(() -> PermanentStageException.transcriptNotFound(meetingId));

    List<TextChunk> chunks = chunker.chunk(transcript);
    List<float[]> vectors =
        chunks.isEmpty()
            ? List.of()
            : embeddingGenerator.embed(chunks.stream().map(TextChunk::text).toList());

    if (vectors.size() != chunks.size()) {
      throw new EmbeddingException(
          String.format("Got %d embeddings for %d chunks", vectors.size(), chunks.size()));
    }

    List<TranscriptChunk> stored = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      stored.add(
          new TranscriptChunk(
              meetingId,
              chunk.index(),
              chunk.text(),
              chunk.startTime(),
              chunk.endTime(),
              vectors.get(i)));
    }
    chunkRepository.replaceAll(meetingId, stored);

    LOGGER.info("Chunks stored: meetingId={}, chunks={}", meetingId, stored.size());

    advanceStatus(meetingId, MeetingStatus.READY);
  }
}
