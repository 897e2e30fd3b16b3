package com.scholary.transcriber.capability;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A loaded capability instance shared by every job that needs its key.
 *
 * <p>When the instance is not safe for concurrent use, calls go through a lock that is held for
 * one call only, never across a whole job.
 */
public final class CapabilityHandle<T> {

  private final CapabilityKey key;
  private final T capability;
  private final ReentrantLock lock;

  public CapabilityHandle(CapabilityKey key, T capability, boolean serializeCalls) {
    this.key = key;
    this.capability = capability;
    this.lock = serializeCalls ? new ReentrantLock(true) : null;
  }

  public CapabilityKey key() {
    return key;
  }

  public boolean isSerialized() {
    return lock != null;
  }

  public <R> R call(Function<T, R> action) {
    if (lock == null) {
      return action.apply(capability);
    }
    lock.lock();
    try {
      return action.apply(capability);
    } finally {
      lock.unlock();
    }
  }
}
