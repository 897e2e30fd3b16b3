package com.scholary.transcriber.export;

import com.scholary.transcriber.job.StorageInfo;
import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreProperties;
import com.scholary.transcriber.transcript.TranscriptionResult;
import java.io.ByteArrayInputStream;
import java.net.URL;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Uploads the JSON and SRT exports of a completed job to object storage.
 *
 * <p>Only active when an {@link ObjectStoreClient} bean exists, i.e. {@code objectstore.enabled}
 * is true. Keys are {@code {prefix}/{jobId}.json} and {@code {prefix}/{jobId}.srt}.
 */
@Component
public class TranscriptArchiver {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptArchiver.class);

  private final Optional<ObjectStoreClient> objectStoreClient;
  private final ObjectStoreProperties properties;
  private final TranscriptExporter exporter;

  public TranscriptArchiver(
      Optional<ObjectStoreClient> objectStoreClient,
      ObjectStoreProperties properties,
      TranscriptExporter exporter) {
    this.objectStoreClient = objectStoreClient;
    this.properties = properties;
    this.exporter = exporter;
  }

  public boolean isEnabled() {
    return properties.enabled() && objectStoreClient.isPresent();
  }

  /**
   * Archive a result and return where it went.
   *
   * @throws com.scholary.transcriber.objectstore.ObjectStoreException if an upload fails
   * @throws IllegalStateException if archiving is disabled
   */
  public StorageInfo archive(String jobId, TranscriptionResult result) {
    ObjectStoreClient client =
        objectStoreClient.orElseThrow(() -> new IllegalStateException("Archiving is disabled"));
    String bucket = properties.bucket();
    String jsonKey = properties.prefix() + "/" + jobId + ExportFormat.JSON.extension();
    String srtKey = properties.prefix() + "/" + jobId + ExportFormat.SRT.extension();

    byte[] jsonBytes = exporter.export(result, ExportFormat.JSON, Map.of());
    byte[] srtBytes = exporter.export(result, ExportFormat.SRT, Map.of());

    client.putObject(
        bucket, jsonKey, new ByteArrayInputStream(jsonBytes), jsonBytes.length, "application/json");
    client.putObject(
        bucket, srtKey, new ByteArrayInputStream(srtBytes), srtBytes.length, "text/plain");

    Duration ttl = Duration.ofDays(properties.presignTtlDays());
    URL jsonUrl = client.presignGet(bucket, jsonKey, ttl);
    URL srtUrl = client.presignGet(bucket, srtKey, ttl);

    LOGGER.info("Archived transcript of job {} to {}/{}", jobId, bucket, jsonKey);
    return new StorageInfo(bucket, jsonKey, jsonUrl.toString(), srtKey, srtUrl.toString());
  }
}
