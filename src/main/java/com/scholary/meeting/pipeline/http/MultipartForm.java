package com.scholary.meeting.pipeline.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Builds a multipart/form-data body for {@link java.net.http.HttpClient}, which has no multipart
 * support of its own.
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="file"; filename="meeting.mp3"
 * Content-Type: audio/mpeg
 *
 * [binary data]
 * --boundary
 * Content-Disposition: form-data; name="language"
 *
 * en
 * --boundary--
 * </pre>
 *
 * <p>The body is assembled as raw bytes so the length the client computes always matches what is
 * sent.
 */
public final class MultipartForm {

  private final String boundary = UUID.randomUUID().toString();
  private final ByteArrayOutputStream body = new ByteArrayOutputStream();

  public MultipartForm addFile(String name, Path file, String contentType) throws IOException {
    writeAscii("--" + boundary + "\r\n");
    writeAscii(
        "Content-Disposition: form-data; name=\""
            + name
            + "\"; filename=\""
            + file.getFileName()
            + "\"\r\n");
    writeAscii("Content-Type: " + contentType + "\r\n\r\n");
    body.write(Files.readAllBytes(file));
    writeAscii("\r\n");
    return this;
  }

  public MultipartForm addField(String name, String value) {
    writeAscii("--" + boundary + "\r\n");
    writeAscii("Content-Disposition: form-data; name=\"" + name + "\"\r\n\r\n");
    body.writeBytes(value.getBytes(StandardCharsets.UTF_8));
    writeAscii("\r\n");
    return this;
  }

  public String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  public BodyPublisher build() {
    writeAscii("--" + boundary + "--\r\n");
    return BodyPublishers.ofByteArray(body.toByteArray());
  }

  private void writeAscii(String text) {
    body.writeBytes(text.getBytes(StandardCharsets.US_ASCII));
  }
}
