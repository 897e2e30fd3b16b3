package com.scholary.transcriber.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin JSON-over-HTTP client for one remote model server.
 *
 * <p>Uses the JDK {@code HttpClient}: the request bodies are simple and multipart encoding is done
 * by {@link MultipartBody}. A non-2xx answer becomes a {@link ModelServerResponseException}, an
 * unreadable body a Jackson exception; both are {@link IOException}s.
 */
public class ModelServerClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelServerClient.class);

  private final String name;
  private final String baseUrl;
  private final Duration readTimeout;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  public ModelServerClient(
      String name, RemoteCapabilityProperties properties, ObjectMapper objectMapper) {
    this.name = name;
    this.baseUrl = stripTrailingSlash(properties.baseUrl());
    this.readTimeout = Duration.ofSeconds(properties.readTimeout());
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();
  }

  public String name() {
    return name;
  }

  public String baseUrl() {
    return baseUrl;
  }

  public <T> T postJson(String path, Object body, Class<T> responseType)
      throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(readTimeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)))
            .build();
    return send(request, responseType);
  }

  public <T> T postMultipart(String path, MultipartBody body, Class<T> responseType)
      throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(readTimeout)
            .header("Content-Type", body.contentType())
            .header("Accept", "application/json")
            .POST(body.publisher())
            .build();
    return send(request, responseType);
  }

  private <T> T send(HttpRequest request, Class<T> responseType)
      throws IOException, InterruptedException {
    LOGGER.debug("Sending request to {}: {}", name, request.uri());

    HttpResponse<byte[]> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());

    if (response.statusCode() / 100 != 2) {
      throw new ModelServerResponseException(
          name, response.statusCode(), new String(response.body(), StandardCharsets.UTF_8));
    }
    if (responseType == Void.class || response.body().length == 0) {
      return null;
    }
    return objectMapper.readValue(response.body(), responseType);
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
