package com.scholary.meeting.pipeline.diarization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.pipeline.http.MultipartForm;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls a pyannote-style diarization service at {@code {baseUrl}/api/v1/diarize}.
 *
 * <p>Expects {@code {"segments":[{"speaker":"SPEAKER_00","start":0.0,"end":2.5}],
 * "numSpeakers":1}}.
 */
public class HttpSpeakerDiarizer implements SpeakerDiarizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSpeakerDiarizer.class);

  private final HttpClient httpClient;
  private final DiarizationProperties properties;
  private final ObjectMapper objectMapper;

  public HttpSpeakerDiarizer(DiarizationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized diarization client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public List<SpeakerTurn> diarize(Path audioFile) {
    try {
      MultipartForm form = new MultipartForm().addFile("file", audioFile, "audio/mpeg");

      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/api/v1/diarize"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", form.contentType())
              .POST(form.build())
              .build();

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() != 200) {
        throw new DiarizationException(
            String.format(
                "Diarization API returned status %d: %s",
                response.statusCode(), response.body()));
      }

      DiarizationResponse parsed =
          objectMapper.readValue(response.body(), DiarizationResponse.class);
      List<SpeakerTurn> turns =
          parsed.segments() == null
              ? List.of()
              : parsed.segments().stream()
                  .sorted(Comparator.comparingDouble(SpeakerTurn::start))
                  .toList();

      LOGGER.info(
          "Diarization complete: {} turns, {} speakers",
          turns.size(),
          turns.stream().map(SpeakerTurn::speaker).distinct().count());
      return turns;

    } catch (IOException e) {
      throw new DiarizationException("Diarization request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DiarizationException("Diarization interrupted", e);
    }
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record DiarizationResponse(List<SpeakerTurn> segments, Integer numSpeakers) {}
}
