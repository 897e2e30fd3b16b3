package com.scholary.transcriber.audio;

/**
 * A time range in seconds with start and end points.
 *
 * <p>Used for chunk boundaries of a normalized file. All times are in seconds with fractional
 * precision.
 */
public record TimeRange(double start, double end) {

  public TimeRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return end - start;
  }

  /**
   * Check if this range contains a given time point.
   *
   * @param time the time to check
   * @return true if time is within [start, end)
   */
  public boolean contains(double time) {
    return time >= start && time < end;
  }

  /** True if the two ranges share more than a boundary point. */
  public boolean overlaps(TimeRange other) {
    return this.start < other.end && other.start < this.end;
  }
}
