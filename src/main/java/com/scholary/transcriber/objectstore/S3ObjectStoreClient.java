package com.scholary.transcriber.objectstore;

import java.io.InputStream;
import java.net.URI;
import java.net.URL;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/**
 * S3/MinIO implementation of {@link ObjectStoreClient} on AWS SDK v2.
 *
 * <p>The SDK retries transient failures (network errors, 5xx, throttling) itself; anything left
 * over is wrapped in an {@link ObjectStoreException}.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    StaticCredentialsProvider credentialsProvider =
        StaticCredentialsProvider.create(
            AwsBasicCredentials.create(properties.accessKey(), properties.secretKey()));

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .endpointOverride(URI.create(properties.endpoint()))
            .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
            .build();

    // Presigned URLs must use the same addressing style as the client.
    this.s3Presigner =
        S3Presigner.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .endpointOverride(URI.create(properties.endpoint()))
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(properties.pathStyleAccess())
                    .build())
            .build();
  }

  @Override
  public void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        contentLength,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength(contentLength)
              .build();

      s3Client.putObject(request, RequestBody.fromInputStream(data, contentLength));

      LOGGER.info("Uploaded object: bucket={}, key={}", bucket, key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error uploading object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public URL presignGet(String bucket, String key, Duration ttl) {
    LOGGER.debug("Generating presigned URL: bucket={}, key={}, ttl={}", bucket, key, ttl);

    try {
      GetObjectPresignRequest presignRequest =
          GetObjectPresignRequest.builder()
              .signatureDuration(ttl)
              .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
              .build();

      return s3Presigner.presignGetObject(presignRequest).url();

    } catch (RuntimeException e) {
      String message =
          String.format("Failed to generate presigned URL: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  /** Release connections and threads. Called by Spring on shutdown. */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client and presigner");
    s3Client.close();
    s3Presigner.close();
  }
}
