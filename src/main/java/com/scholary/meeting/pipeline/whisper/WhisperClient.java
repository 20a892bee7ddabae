package com.scholary.meeting.pipeline.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.pipeline.http.MultipartForm;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the faster-whisper transcription API.
 *
 * <p>One attempt per call. Retrying is the pipeline's job, so a failure here surfaces at once as a
 * {@link WhisperException}.
 */
@Component
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public WhisperResponse transcribe(Path audioFile) {
    LOGGER.info("Transcribing recording: file={}", audioFile.getFileName());

    try {
      MultipartForm form = new MultipartForm().addFile("file", audioFile, "audio/mpeg");
      if (properties.hasForcedLanguage()) {
        form.addField("language", properties.language());
      }

      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", form.contentType())
              .POST(form.build())
              .build();

      LOGGER.debug("Sending transcription request to {}", request.uri());

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() != 200) {
        throw new WhisperException(
            String.format(
                "Whisper API returned status %d: %s", response.statusCode(), response.body()));
      }

      WhisperResponse whisperResponse =
          objectMapper.readValue(response.body(), WhisperResponse.class);

      LOGGER.info(
          "Transcription successful: {} segments, language={}",
          whisperResponse.segments().size(),
          whisperResponse.language());

      return whisperResponse;

    } catch (IOException e) {
      throw new WhisperException("Whisper request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WhisperException("Transcription interrupted", e);
    }
  }
}
