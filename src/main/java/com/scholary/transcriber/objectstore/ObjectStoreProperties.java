package com.scholary.transcriber.objectstore;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for transcript archiving, bound to {@code objectstore.*}.
 *
 * <p>When {@code enabled} is false no S3 client is created and completed jobs are not archived.
 *
 * @param prefix key prefix for archived transcripts, e.g. {@code transcripts}
 * @param presignTtlDays lifetime of the presigned URLs stored on the job
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    boolean enabled,
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    @NotBlank String prefix,
    @Positive int presignTtlDays) {}
