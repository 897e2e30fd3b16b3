package com.scholary.transcriber.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.transcriber.audio.StagedUpload;
import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.transcript.TranscriptSegment;
import com.scholary.transcriber.transcript.TranscriptionResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InMemoryJobStoreTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir Path tempDir;

  private final AtomicLong nanos = new AtomicLong();
  private MutableClock clock;
  private InMemoryJobStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    store = new InMemoryJobStore(new JobStoreProperties(2, 60), clock, nanos::get);
  }

  @Test
  void create_shouldStorePendingJob() {
    String id = store.create(JobOptions.defaults(), upload("a.wav"));

    TranscriptionJob job = store.get(id);
    assertThat(job.status()).isEqualTo(JobStatus.PENDING);
    assertThat(job.progress()).isZero();
    assertThat(job.createdAt()).isEqualTo(T0);
    assertThat(job.options().modelSize()).isEqualTo(ModelSize.BASE);
  }

  @Test
  void transition_shouldFollowLifecycleToCompletion() {
    String id = store.create(JobOptions.defaults(), upload("a.wav"));

    clock.advance(Duration.ofSeconds(5));
    TranscriptionJob started = store.transition(id, JobEvent.start());
    assertThat(started.status()).isEqualTo(JobStatus.PROCESSING);
    assertThat(started.startedAt()).isEqualTo(T0.plusSeconds(5));

    assertThat(store.transition(id, JobEvent.progress(40)).progress()).isEqualTo(40);

    clock.advance(Duration.ofSeconds(5));
    TranscriptionJob completed = store.transition(id, JobEvent.complete(result()));
    assertThat(completed.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(completed.progress()).isEqualTo(100);
    assertThat(completed.result().text()).isEqualTo("hello");
    assertThat(completed.completedAt()).isEqualTo(T0.plusSeconds(10));
  }

  @Test
  void transition_shouldKeepProgressMonotonic() {
    String id = started();
    store.transition(id, JobEvent.progress(50));

    assertThat(store.transition(id, JobEvent.progress(30)).progress()).isEqualTo(50);
    assertThat(store.transition(id, JobEvent.progress(150)).progress()).isEqualTo(99);
  }

  @Test
  void transition_shouldKeepProgressOnFailure() {
    String id = started();
    store.transition(id, JobEvent.progress(45));

    TranscriptionJob failed =
        store.transition(id, JobEvent.fail(JobError.of(ErrorKind.TRANSCRIPTION_ERROR, "boom")));

    assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.progress()).isEqualTo(45);
    assertThat(failed.error().code()).isEqualTo("TRANSCRIPTION_ERROR");
    assertThat(failed.result()).isNull();
  }

  @Test
  void transition_shouldRejectEventsAfterTerminalState() {
    String id = started();
    store.transition(id, JobEvent.complete(result()));

    assertThatThrownBy(() -> store.transition(id, JobEvent.progress(10)))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(
            () -> store.transition(id, JobEvent.fail(JobError.of(ErrorKind.CANCELED, "late"))))
        .isInstanceOf(InvalidStateException.class);
    assertThat(store.get(id).status()).isEqualTo(JobStatus.COMPLETED);
  }

  @Test
  void transition_shouldRejectProgressBeforeStart() {
    String id = store.create(JobOptions.defaults(), upload("a.wav"));

    assertThatThrownBy(() -> store.transition(id, JobEvent.progress(10)))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("pending");
  }

  @Test
  void transition_shouldFailForUnknownJob() {
    assertThatThrownBy(() -> store.transition("missing", JobEvent.start()))
        .isInstanceOf(JobNotFoundException.class)
        .hasMessage("Job not found: missing");
  }

  @Test
  void listeners_shouldReceiveEachChangeOnce() {
    List<TranscriptionJob> seen = new ArrayList<>();
    store.addListener(seen::add);
    store.addListener(
        job -> {
          throw new IllegalStateException("listener bug");
        });

    String id = store.create(JobOptions.defaults(), upload("a.wav"));
    store.transition(id, JobEvent.start());
    store.transition(id, JobEvent.progress(20));
    store.transition(id, JobEvent.progress(10));
    store.transition(id, JobEvent.complete(result()));

    assertThat(seen)
        .extracting(TranscriptionJob::status)
        .containsExactly(
            JobStatus.PENDING, JobStatus.PROCESSING, JobStatus.PROCESSING, JobStatus.COMPLETED);
  }

  @Test
  void delete_shouldRejectRunningJob() {
    String id = started();

    assertThatThrownBy(() -> store.delete(id))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("cannot be deleted");
    assertThat(store.find(id)).isPresent();
  }

  @Test
  void delete_shouldRemoveFinishedJobAndItsUpload() {
    StagedUpload upload = upload("a.wav");
    String id = store.create(JobOptions.defaults(), upload);
    store.transition(id, JobEvent.start());
    store.transition(id, JobEvent.complete(result()));

    store.delete(id);

    assertThat(store.find(id)).isEmpty();
    assertThat(upload.path()).doesNotExist();
  }

  @Test
  void expiry_shouldDropFinishedJobsAfterRetentionAndDeleteFiles() {
    StagedUpload upload = upload("a.wav");
    String id = store.create(JobOptions.defaults(), upload);
    store.transition(id, JobEvent.start());
    store.transition(id, JobEvent.complete(result()));

    nanos.addAndGet(TimeUnit.MINUTES.toNanos(61));
    store.cleanUp();

    assertThat(store.find(id)).isEmpty();
    assertThat(upload.path()).doesNotExist();
  }

  @Test
  void expiry_shouldNeverDropUnfinishedJobs() {
    String pending = store.create(JobOptions.defaults(), upload("a.wav"));
    String running = started();

    nanos.addAndGet(TimeUnit.DAYS.toNanos(30));
    store.cleanUp();

    assertThat(store.find(pending)).isPresent();
    assertThat(store.find(running)).isPresent();
  }

  @Test
  void capacity_shouldOnlyCountFinishedJobs() {
    List<String> running = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      running.add(started());
    }
    for (int i = 0; i < 4; i++) {
      String id = started();
      store.transition(id, JobEvent.complete(result()));
    }
    store.cleanUp();

    assertThat(store.countByStatus().get(JobStatus.COMPLETED)).isLessThanOrEqualTo(2L);
    assertThat(running).allSatisfy(id -> assertThat(store.find(id)).isPresent());
  }

  @Test
  void findByStatus_shouldReturnOldestFirst() {
    String first = started();
    clock.advance(Duration.ofMinutes(1));
    String second = started();
    clock.advance(Duration.ofMinutes(1));
    store.create(JobOptions.defaults(), upload("c.wav"));

    assertThat(store.findByStatus(JobStatus.PROCESSING))
        .extracting(TranscriptionJob::id)
        .containsExactly(first, second);
    assertThat(store.countByStatus())
        .containsEntry(JobStatus.PROCESSING, 2L)
        .containsEntry(JobStatus.PENDING, 1L)
        .containsEntry(JobStatus.FAILED, 0L);
  }

  private String started() {
    String id = store.create(JobOptions.defaults(), upload("job.wav"));
    store.transition(id, JobEvent.start());
    return id;
  }

  private StagedUpload upload(String name) {
    try {
      Path file = Files.createTempFile(tempDir, "upload", name);
      Files.writeString(file, "audio");
      return new StagedUpload(file, name, 5);
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
  }

  private static TranscriptionResult result() {
    return TranscriptionResult.of(
        List.of(new TranscriptSegment(0, "hello", 0.0, 1.0, 0.9)), "en", 1.0, List.of());
  }

  private static final class MutableClock extends Clock {

    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
