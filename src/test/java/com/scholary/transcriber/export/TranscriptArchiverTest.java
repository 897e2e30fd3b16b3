package com.scholary.transcriber.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.job.StorageInfo;
import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreException;
import com.scholary.transcriber.objectstore.ObjectStoreProperties;
import com.scholary.transcriber.transcript.TranscriptSegment;
import com.scholary.transcriber.transcript.TranscriptionResult;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptArchiverTest {

  private static final TranscriptionResult RESULT =
      TranscriptionResult.of(
          List.of(new TranscriptSegment(0, "Hello world", 0.0, 1.5, 0.9)), "en", 1.5, List.of());

  @Mock private ObjectStoreClient client;

  @Test
  void archive_shouldUploadJsonAndSrtAndPresign() throws Exception {
    TranscriptArchiver archiver = archiver(Optional.of(client), true);
    when(client.presignGet("transcripts", "jobs/job-1.json", Duration.ofDays(7)))
        .thenReturn(URI.create("http://minio/transcripts/jobs/job-1.json?sig").toURL());
    when(client.presignGet("transcripts", "jobs/job-1.srt", Duration.ofDays(7)))
        .thenReturn(URI.create("http://minio/transcripts/jobs/job-1.srt?sig").toURL());

    StorageInfo storage = archiver.archive("job-1", RESULT);

    verify(client)
        .putObject(
            eq("transcripts"), eq("jobs/job-1.json"), any(), anyLong(), eq("application/json"));
    verify(client)
        .putObject(eq("transcripts"), eq("jobs/job-1.srt"), any(), anyLong(), eq("text/plain"));
    assertThat(storage.bucket()).isEqualTo("transcripts");
    assertThat(storage.jsonKey()).isEqualTo("jobs/job-1.json");
    assertThat(storage.srtUrl()).isEqualTo("http://minio/transcripts/jobs/job-1.srt?sig");
  }

  @Test
  void archive_shouldPropagateUploadFailure() {
    TranscriptArchiver archiver = archiver(Optional.of(client), true);
    doThrow(new ObjectStoreException("Failed to upload object"))
        .when(client)
        .putObject(any(), any(), any(), anyLong(), any());

    assertThatThrownBy(() -> archiver.archive("job-1", RESULT))
        .isInstanceOf(ObjectStoreException.class);
  }

  @Test
  void isEnabled_shouldRequireClientAndFlag() {
    assertThat(archiver(Optional.of(client), true).isEnabled()).isTrue();
    assertThat(archiver(Optional.of(client), false).isEnabled()).isFalse();
    assertThat(archiver(Optional.empty(), true).isEnabled()).isFalse();
  }

  private static TranscriptArchiver archiver(Optional<ObjectStoreClient> client, boolean enabled) {
    ObjectStoreProperties properties =
        new ObjectStoreProperties(
            enabled,
            "http://localhost:9000",
            "minioadmin",
            "minioadmin",
            "transcripts",
            "us-east-1",
            true,
            "jobs",
            7);
    return new TranscriptArchiver(
        client, properties, new TranscriptExporter(new ObjectMapper()));
  }
}
