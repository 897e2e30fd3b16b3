package com.scholary.transcriber.service;

import com.scholary.transcriber.job.JobListener;
import com.scholary.transcriber.job.JobStore;
import com.scholary.transcriber.job.TranscriptionJob;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Read side of job progress: polling snapshots and per-job subscriptions.
 *
 * <p>A subscriber gets the current snapshot right after registering, then every later
 * transition, so it sees the terminal state at least once no matter when it subscribed. It may
 * see the same snapshot twice, but never one older than a snapshot it already received.
 * Subscriptions end by themselves after the terminal snapshot.
 */
@Service
public class ProgressReporter implements JobListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressReporter.class);

  static final String SSE_EVENT_NAME = "job";

  private final JobStore jobStore;
  private final long sseTimeoutMs;
  private final Map<String, List<OrderedListener>> subscribers = new ConcurrentHashMap<>();

  public ProgressReporter(
      JobStore jobStore, @Value("${progress.sse-timeout-ms:0}") long sseTimeoutMs) {
    this.jobStore = jobStore;
    this.sseTimeoutMs = sseTimeoutMs;
    jobStore.addListener(this);
  }

  /** @throws com.scholary.transcriber.job.JobNotFoundException if the id is unknown */
  public TranscriptionJob status(String jobId) {
    return jobStore.get(jobId);
  }

  /**
   * Deliver the current snapshot of {@code jobId} and every later one to {@code listener}.
   *
   * @throws com.scholary.transcriber.job.JobNotFoundException if the id is unknown
   */
  public void subscribe(String jobId, JobListener listener) {
    jobStore.get(jobId);
    OrderedListener ordered = new OrderedListener(listener);
    subscribers.computeIfAbsent(jobId, id -> new CopyOnWriteArrayList<>()).add(ordered);

    // A transition may reach the listener between registration and this read.
    TranscriptionJob current = jobStore.find(jobId).orElse(null);
    if (current == null) {
      unsubscribe(jobId, listener);
      return;
    }
    ordered.deliver(current);
    if (current.isTerminal()) {
      unsubscribe(jobId, listener);
    }
  }

  public void unsubscribe(String jobId, JobListener listener) {
    subscribers.computeIfPresent(
        jobId,
        (id, listeners) -> {
          listeners.removeIf(ordered -> ordered.delegate == listener);
          return listeners.isEmpty() ? null : listeners;
        });
  }

  int subscriberCount(String jobId) {
    List<OrderedListener> listeners = subscribers.get(jobId);
    return listeners == null ? 0 : listeners.size();
  }

  /** Server-sent event stream of snapshots, completed after the terminal one. */
  public SseEmitter stream(String jobId) {
    jobStore.get(jobId);
    SseEmitter emitter = new SseEmitter(sseTimeoutMs);
    JobListener listener = new JobListener() {
      @Override
      public void onTransition(TranscriptionJob job) {
        try {
          emitter.send(SseEmitter.event().name(SSE_EVENT_NAME).id(eventId(job)).data(job));
          if (job.isTerminal()) {
            emitter.complete();
          }
        } catch (IOException | IllegalStateException e) {
          LOGGER.debug("Dropping event stream for job {}: {}", jobId, e.getMessage());
          unsubscribe(jobId, this);
        }
      }
    };
    emitter.onCompletion(() -> unsubscribe(jobId, listener));
    emitter.onTimeout(() -> unsubscribe(jobId, listener));
    emitter.onError(e -> unsubscribe(jobId, listener));
    subscribe(jobId, listener);
    return emitter;
  }

  @Override
  public void onTransition(TranscriptionJob job) {
    List<OrderedListener> listeners = subscribers.get(job.id());
    if (listeners == null) {
      return;
    }
    for (OrderedListener listener : listeners) {
      listener.deliver(job);
    }
    if (job.isTerminal()) {
      subscribers.remove(job.id());
    }
  }

  private static String eventId(TranscriptionJob job) {
    return job.status().value() + "-" + job.progress();
  }

  /** Position of a snapshot in the job's forward-only lifecycle. */
  static int stage(TranscriptionJob job) {
    switch (job.status()) {
      case PENDING:
        return 0;
      case PROCESSING:
        return 1;
      default:
        return 2;
    }
  }

  /** Whether {@code next} is not older than {@code last}. */
  static boolean isNotBehind(TranscriptionJob last, TranscriptionJob next) {
    if (last.isTerminal()) {
      return false;
    }
    int lastStage = stage(last);
    int nextStage = stage(next);
    if (nextStage != lastStage) {
      return nextStage > lastStage;
    }
    return next.progress() >= last.progress();
  }

  /** Serializes deliveries to one subscriber and drops snapshots older than the last one sent. */
  private static final class OrderedListener {

    private final JobListener delegate;
    private TranscriptionJob last;

    OrderedListener(JobListener delegate) {
      this.delegate = delegate;
    }

    synchronized void deliver(TranscriptionJob job) {
      if (last != null && !isNotBehind(last, job)) {
        return;
      }
      last = job;
      try {
        delegate.onTransition(job);
      } catch (RuntimeException e) {
        LOGGER.warn("Progress subscriber for job {} failed", job.id(), e);
      }
    }
  }
}
