package com.scholary.meeting.pipeline.whisper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Runs the client against a local stub of the Whisper API. */
class WhisperClientTest {

  @TempDir Path tempDir;

  private HttpServer server;
  private final AtomicReference<String> requestBody = new AtomicReference<>();
  private volatile int status = 200;
  private volatile String responseBody;

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext(
        "/api/v1/transcribe",
        exchange -> {
          requestBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.ISO_8859_1));
          byte[] body = responseBody.getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(status, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void uploadsRecordingAndParsesSegments() throws IOException {
    responseBody =
        "{\"segments\":[{\"start\":0.0,\"end\":1.2,\"text\":\"Good morning\"}],"
            + "\"language\":\"en\",\"model\":\"large-v3\"}";
    Path audio = Files.writeString(tempDir.resolve("standup.mp3"), "ID3-bytes");

    WhisperResponse response = client("de").transcribe(audio);

    assertThat(response.language()).isEqualTo("en");
    assertThat(response.segments()).containsExactly(new WhisperSegment(0.0, 1.2, "Good morning"));
    assertThat(response.duration()).isNull();
    assertThat(requestBody.get())
        .contains("filename=\"standup.mp3\"")
        .contains("ID3-bytes")
        .contains("name=\"language\"")
        .contains("de");
  }

  @Test
  void errorStatusFailsImmediately() throws IOException {
    status = 503;
    responseBody = "busy";
    Path audio = Files.writeString(tempDir.resolve("standup.mp3"), "ID3-bytes");

    assertThatThrownBy(() -> client("").transcribe(audio))
        .isInstanceOf(WhisperException.class)
        .hasMessageContaining("status 503");
  }

  private WhisperClient client(String language) {
    String baseUrl = "http://localhost:" + server.getAddress().getPort();
    return new WhisperClient(
        new WhisperProperties(baseUrl, 5, 10, language, tempDir.toString()), new ObjectMapper());
  }
}
