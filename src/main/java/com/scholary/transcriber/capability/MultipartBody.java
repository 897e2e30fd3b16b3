package com.scholary.transcriber.capability;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Builds a multipart/form-data body for the JDK {@code HttpClient}, which has no multipart
 * support of its own:
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="file"; filename="chunk_000.wav"
 * Content-Type: audio/wav
 *
 * [binary data]
 * --boundary
 * Content-Disposition: form-data; name="language"
 *
 * en
 * --boundary--
 * </pre>
 *
 * <p>Everything is assembled as bytes, so the declared and actual body length always agree.
 */
public final class MultipartBody {

  private final String boundary = UUID.randomUUID().toString();
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();

  public MultipartBody file(String name, Path file, String contentType) throws IOException {
    write("--" + boundary + "\r\n");
    write(
        "Content-Disposition: form-data; name=\""
            + name
            + "\"; filename=\""
            + file.getFileName()
            + "\"\r\n");
    write("Content-Type: " + contentType + "\r\n\r\n");
    out.write(Files.readAllBytes(file));
    write("\r\n");
    return this;
  }

  /** Adds a text field; null values are skipped. */
  public MultipartBody field(String name, Object value) {
    if (value == null) {
      return this;
    }
    write("--" + boundary + "\r\n");
    write("Content-Disposition: form-data; name=\"" + name + "\"\r\n\r\n");
    write(value + "\r\n");
    return this;
  }

  public String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  public BodyPublisher publisher() {
    ByteArrayOutputStream copy = new ByteArrayOutputStream(out.size() + boundary.length() + 8);
    copy.writeBytes(out.toByteArray());
    copy.writeBytes(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
    return BodyPublishers.ofByteArray(copy.toByteArray());
  }

  private void write(String text) {
    out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
  }
}
