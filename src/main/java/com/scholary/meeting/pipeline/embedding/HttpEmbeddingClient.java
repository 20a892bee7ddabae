package com.scholary.meeting.pipeline.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for an OpenAI-compatible {@code /v1/embeddings} endpoint.
 *
 * <p>Large inputs go out in batches of {@code batchSize}; the result is checked for one vector per
 * input and the configured dimension.
 */
public class HttpEmbeddingClient implements EmbeddingGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpEmbeddingClient.class);

  private final HttpClient httpClient;
  private final EmbeddingProperties properties;
  private final ObjectMapper objectMapper;

  public HttpEmbeddingClient(EmbeddingProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized embedding client: baseUrl={}, model={}, dimension={}",
        properties.baseUrl(),
        properties.model(),
        properties.dimension());
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    LOGGER.info("Generating embeddings for {} texts", texts.size());

    List<float[]> vectors = new ArrayList<>(texts.size());
    for (int from = 0; from < texts.size(); from += properties.batchSize()) {
      List<String> batch = texts.subList(from, Math.min(from + properties.batchSize(), texts.size()));
      vectors.addAll(embedBatch(batch));
    }
    return vectors;
  }

  @Override
  public int dimension() {
    return properties.dimension();
  }

  private List<float[]> embedBatch(List<String> batch) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    batch.forEach(body.putArray("input")::add);

    try {
      HttpRequest.Builder request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/v1/embeddings"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
      if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
        request.header("Authorization", "Bearer " + properties.apiKey());
      }

      HttpResponse<String> response =
          httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() != 200) {
        throw new EmbeddingException(
            String.format(
                "Embedding API returned status %d: %s", response.statusCode(), response.body()));
      }
      return parse(objectMapper.readTree(response.body()), batch.size());

    } catch (IOException e) {
      throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EmbeddingException("Embedding interrupted", e);
    }
  }

  List<float[]> parse(JsonNode root, int expected) {
    JsonNode data = root.path("data");
    if (!data.isArray() || data.size() != expected) {
      throw new EmbeddingException(
          String.format("Expected %d embeddings, got %d", expected, data.size()));
    }

    float[][] ordered = new float[expected][];
    for (int i = 0; i < data.size(); i++) {
      JsonNode item = data.get(i);
      int index = item.path("index").asInt(i);
      JsonNode values = item.path("embedding");
      if (index < 0 || index >= expected || ordered[index] != null) {
        throw new EmbeddingException("Embedding response has a bad index: " + index);
      }
      if (values.size() != properties.dimension()) {
        throw new EmbeddingException(
            String.format(
                "Embedding %d has dimension %d, expected %d",
                index, values.size(), properties.dimension()));
      }
      float[] vector = new float[values.size()];
      for (int d = 0; d < vector.length; d++) {
        vector[d] = (float) values.get(d).asDouble();
      }
      ordered[index] = vector;
    }
    return List.of(ordered);
  }
}
