package com.scholary.transcriber.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Abstraction for the object storage that archived transcripts go to.
 *
 * <p>Works against S3 and S3-compatible services such as MinIO; tests mock it.
 */
public interface ObjectStoreClient {

  /**
   * Store an object.
   *
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Generate a presigned URL for temporary read access to an object.
   *
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);
}
