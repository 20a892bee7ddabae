package com.scholary.meeting.pipeline.whisper;

import com.scholary.meeting.pipeline.diarization.SpeakerDiarizer;
import com.scholary.meeting.pipeline.diarization.SpeakerLabeler;
import com.scholary.meeting.pipeline.diarization.SpeakerTurn;
import com.scholary.meeting.pipeline.meeting.TranscriptSegment;
import com.scholary.meeting.pipeline.objectstore.AudioLocation;
import com.scholary.meeting.pipeline.objectstore.ObjectNotFoundException;
import com.scholary.meeting.pipeline.objectstore.ObjectStoreClient;
import com.scholary.meeting.pipeline.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.meeting.pipeline.objectstore.ObjectStoreProperties;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloads a recording from object storage, sends it to Whisper and, when a diarizer is enabled,
 * labels the segments with speakers.
 *
 * <p>Diarization is best effort: if it fails the transcript is returned without speaker labels.
 */
@Component
public class WhisperTranscriber implements SpeechTranscriber {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperTranscriber.class);

  static final String DEFAULT_LANGUAGE = "en";

  private final ObjectStoreClient objectStore;
  private final String defaultBucket;
  private final WhisperService whisperService;
  private final SpeakerDiarizer diarizer;
  private final SpeakerLabeler speakerLabeler;
  private final Path tempDir;

  public WhisperTranscriber(
      ObjectStoreClient objectStore,
      ObjectStoreProperties objectStoreProperties,
      WhisperService whisperService,
      SpeakerDiarizer diarizer,
      SpeakerLabeler speakerLabeler,
      WhisperProperties whisperProperties) {
    this.objectStore = objectStore;
    this.defaultBucket = objectStoreProperties.bucket();
    this.whisperService = whisperService;
    this.diarizer = diarizer;
    this.speakerLabeler = speakerLabeler;
    this.tempDir = Path.of(whisperProperties.tempDir());
  }

  @Override
  public TranscriptionResult transcribe(String audioReference) {
    AudioLocation location;
    try {
      location = AudioLocation.parse(audioReference, defaultBucket);
    } catch (IllegalArgumentException e) {
      throw new AudioNotFoundException("Invalid audio reference: " + audioReference, e);
    }

    Path audioFile = download(location);
    try {
      WhisperResponse response = whisperService.transcribe(audioFile);

      List<TranscriptSegment> segments =
          response.segments().stream()
              .map(s -> new TranscriptSegment(s.start(), s.end(), s.text().strip()))
              .toList();
      segments = labelSpeakers(audioFile, segments);

      String text =
          response.text() != null && !response.text().isBlank()
              ? response.text().strip()
              : segments.stream().map(TranscriptSegment::text).collect(Collectors.joining(" "));

      double duration =
          response.duration() != null
              ? response.duration()
              : segments.isEmpty() ? 0.0 : segments.get(segments.size() - 1).end();

      String language =
          response.language() == null || response.language().isBlank()
              ? DEFAULT_LANGUAGE
              : response.language();

      LOGGER.info(
          "Transcription complete: location={}, segments={}, duration={}s, language={}",
          location,
          segments.size(),
          duration,
          language);

      return new TranscriptionResult(text, language, duration, segments);

    } finally {
      deleteTempFile(audioFile);
    }
  }

  private Path download(AudioLocation location) {
    try {
      ObjectMetadata metadata = objectStore.getObjectMetadata(location.bucket(), location.key());
      LOGGER.info(
          "Downloading recording: location={}, size={} bytes", location, metadata.contentLength());

      Files.createDirectories(tempDir);
      Path target = Files.createTempFile(tempDir, "meeting-", "-" + location.fileName());
      try (InputStream in = objectStore.getObjectStream(location.bucket(), location.key())) {
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
      } catch (IOException | RuntimeException e) {
        deleteTempFile(target);
        throw e;
      }
      return target;

    } catch (ObjectNotFoundException e) {
      throw new AudioNotFoundException("Audio not found: " + location, e);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not download " + location, e);
    }
  }

  private List<TranscriptSegment> labelSpeakers(Path audioFile, List<TranscriptSegment> segments) {
    if (!diarizer.isEnabled() || segments.isEmpty()) {
      return segments;
    }
    try {
      List<SpeakerTurn> turns = diarizer.diarize(audioFile);
      return speakerLabeler.label(segments, turns);
    } catch (RuntimeException e) {
      LOGGER.warn("Diarization failed, keeping unlabeled segments: {}", e.getMessage());
      return segments;
    }
  }

  private void deleteTempFile(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file {}: {}", file, e.getMessage());
    }
  }
}
