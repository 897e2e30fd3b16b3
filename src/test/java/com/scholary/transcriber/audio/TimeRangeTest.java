package com.scholary.transcriber.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimeRangeTest {

  @Test
  void constructor_shouldRejectNegativeStart() {
    assertThatThrownBy(() -> new TimeRange(-1.0, 10.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }

  @Test
  void constructor_shouldRejectEndBeforeStart() {
    assertThatThrownBy(() -> new TimeRange(10.0, 5.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("End time must be >= start time");
  }

  @Test
  void duration_shouldBeEndMinusStart() {
    assertThat(new TimeRange(300.0, 600.5).duration()).isEqualTo(300.5);
  }

  @Test
  void contains_shouldIncludeStartAndExcludeEnd() {
    TimeRange range = new TimeRange(0.0, 300.0);
    assertThat(range.contains(0.0)).isTrue();
    assertThat(range.contains(299.9)).isTrue();
    assertThat(range.contains(300.0)).isFalse();
  }

  @Test
  void overlaps_shouldIgnoreSharedBoundary() {
    TimeRange first = new TimeRange(0.0, 300.0);
    assertThat(first.overlaps(new TimeRange(300.0, 600.0))).isFalse();
    assertThat(first.overlaps(new TimeRange(299.0, 600.0))).isTrue();
    assertThat(new TimeRange(299.0, 600.0).overlaps(first)).isTrue();
  }
}
