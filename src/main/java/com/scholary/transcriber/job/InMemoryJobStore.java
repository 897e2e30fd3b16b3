package com.scholary.transcriber.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.transcriber.audio.AudioAsset;
import com.scholary.transcriber.audio.StagedUpload;
import com.scholary.transcriber.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory job store backed by a Caffeine cache.
 *
 * <p>Pending and processing jobs weigh nothing and never expire, so Caffeine can only evict
 * finished jobs: those count against {@code jobstore.maxTerminalJobs} and expire {@code
 * jobstore.retainTerminalMinutes} after their last write. An evicted job's upload and normalized
 * audio are deleted by the removal listener.
 *
 * <p>Every mutation is one {@code asMap().compute} that swaps an immutable {@link
 * TranscriptionJob}; listeners run afterwards, outside the map lock.
 */
@Repository
public class InMemoryJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryJobStore.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final Cache<String, JobEntry> cache;
  private final Clock clock;
  private final List<JobListener> listeners = new CopyOnWriteArrayList<>();

  @Autowired
  public InMemoryJobStore(JobStoreProperties properties) {
    this(properties, Clock.systemUTC(), Ticker.systemTicker());
  }

  InMemoryJobStore(JobStoreProperties properties, Clock clock, Ticker ticker) {
    this.clock = clock;
    long retainNanos = Duration.ofMinutes(properties.retainTerminalMinutes()).toNanos();
    this.cache =
        Caffeine.newBuilder()
            .ticker(ticker)
            .executor(Runnable::run)
            .maximumWeight(properties.maxTerminalJobs())
            .weigher((String id, JobEntry entry) -> entry.job().isTerminal() ? 1 : 0)
            .expireAfter(new TerminalExpiry(retainNanos))
            .removalListener(
                (String id, JobEntry entry, RemovalCause cause) -> {
                  if (entry != null && cause.wasEvicted()) {
                    LOGGER.info("Evicted job {} ({})", id, cause);
                    releaseFiles(entry);
                  }
                })
            .build();
  }

  @Override
  public String create(JobOptions options, StagedUpload upload) {
    String id = UUID.randomUUID().toString();
    TranscriptionJob job = TranscriptionJob.pending(id, options, clock.instant());
    cache.put(id, new JobEntry(job, upload, null));
    LOGGER.info("Created job {} for {}", id, upload == null ? null : upload.originalName());
    notifyListeners(job);
    return id;
  }

  @Override
  public TranscriptionJob transition(String jobId, JobEvent event) {
    AtomicReference<TranscriptionJob> before = new AtomicReference<>();
    JobEntry updated =
        cache
            .asMap()
            .compute(
                jobId,
                (id, entry) -> {
                  if (entry == null) {
                    throw new JobNotFoundException(id);
                  }
                  before.set(entry.job());
                  TranscriptionJob next = entry.job().apply(event, clock.instant());
                  return next == entry.job() ? entry : entry.withJob(next);
                });

    TranscriptionJob previous = before.get();
    TranscriptionJob current = updated.job();
    if (current != previous) {
      STRUCTURED_LOGGER.logJobTransition(
          jobId, previous.status().value(), current.status().value(), current.progress());
      notifyListeners(current);
    }
    return current;
  }

  @Override
  public TranscriptionJob get(String jobId) {
    return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  @Override
  public Optional<TranscriptionJob> find(String jobId) {
    JobEntry entry = cache.getIfPresent(jobId);
    return Optional.ofNullable(entry).map(JobEntry::job);
  }

  @Override
  public StagedUpload upload(String jobId) {
    JobEntry entry = cache.getIfPresent(jobId);
    if (entry == null) {
      throw new JobNotFoundException(jobId);
    }
    return entry.upload();
  }

  @Override
  public void attachAsset(String jobId, AudioAsset asset) {
    cache
        .asMap()
        .compute(
            jobId,
            (id, entry) -> {
              if (entry == null) {
                throw new JobNotFoundException(id);
              }
              if (entry.job().isTerminal()) {
                throw new InvalidStateException("Job " + id + " is already finished");
              }
              return entry.withAsset(asset);
            });
  }

  @Override
  public void delete(String jobId) {
    AtomicReference<JobEntry> removed = new AtomicReference<>();
    cache
        .asMap()
        .compute(
            jobId,
            (id, entry) -> {
              if (entry == null) {
                throw new JobNotFoundException(id);
              }
              if (!entry.job().isTerminal()) {
                throw new InvalidStateException(
                    "Job " + id + " is " + entry.job().status().value() + " and cannot be deleted");
              }
              removed.set(entry);
              return null;
            });
    releaseFiles(removed.get());
    LOGGER.info("Deleted job {}", jobId);
  }

  @Override
  public List<TranscriptionJob> findByStatus(JobStatus status) {
    return cache.asMap().values().stream()
        .map(JobEntry::job)
        .filter(job -> job.status() == status)
        .sorted(Comparator.comparing(TranscriptionJob::createdAt))
        .toList();
  }

  @Override
  public Map<JobStatus, Long> countByStatus() {
    Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
    for (JobStatus status : JobStatus.values()) {
      counts.put(status, 0L);
    }
    cache.asMap().values().forEach(entry -> counts.merge(entry.job().status(), 1L, Long::sum));
    return counts;
  }

  @Override
  public void addListener(JobListener listener) {
    listeners.add(listener);
  }

  /** Run pending evictions now. */
  void cleanUp() {
    cache.cleanUp();
  }

  private void notifyListeners(TranscriptionJob job) {
    for (JobListener listener : listeners) {
      try {
        listener.onTransition(job);
      } catch (RuntimeException e) {
        LOGGER.warn("Job listener failed for job {}: {}", job.id(), e.getMessage(), e);
      }
    }
  }

  private static void releaseFiles(JobEntry entry) {
    if (entry.asset() != null) {
      entry.asset().release();
    }
    if (entry.upload() != null) {
      try {
        Files.deleteIfExists(entry.upload().path());
      } catch (IOException e) {
        LOGGER.warn("Failed to delete upload {}: {}", entry.upload().path(), e.getMessage());
      }
    }
  }

  private record JobEntry(TranscriptionJob job, StagedUpload upload, AudioAsset asset) {

    JobEntry withJob(TranscriptionJob next) {
      return new JobEntry(next, upload, asset);
    }

    JobEntry withAsset(AudioAsset next) {
      return new JobEntry(job, upload, next);
    }
  }

  /** Running jobs never expire; finished ones expire a fixed time after their last write. */
  private static final class TerminalExpiry implements Expiry<String, JobEntry> {

    private final long retainNanos;

    TerminalExpiry(long retainNanos) {
      this.retainNanos = retainNanos;
    }

    @Override
    public long expireAfterCreate(String key, JobEntry value, long currentTime) {
      return value.job().isTerminal() ? retainNanos : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterUpdate(
        String key, JobEntry value, long currentTime, long currentDuration) {
      return value.job().isTerminal() ? retainNanos : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterRead(
        String key, JobEntry value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
