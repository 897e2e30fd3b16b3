package com.scholary.transcriber.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class SegmentSequencesTest {

  @Test
  void normalize_shouldSortByStartAndRenumber() {
    List<TranscriptSegment> result =
        SegmentSequences.normalize(
            List.of(
                new TranscriptSegment(5, "second", 2.0, 3.0, 0.9),
                new TranscriptSegment(3, "first", 0.0, 1.0, 0.9)));

    assertThat(result).extracting(TranscriptSegment::text).containsExactly("first", "second");
    assertThat(result).extracting(TranscriptSegment::id).containsExactly(0, 1);
  }

  @Test
  void normalize_shouldClampOverlapToPreviousEnd() {
    List<TranscriptSegment> result =
        SegmentSequences.normalize(
            List.of(
                new TranscriptSegment(0, "a", 0.0, 2.0, 0.9),
                new TranscriptSegment(1, "b", 1.0, 3.0, 0.9)));

    assertThat(result.get(1).start()).isEqualTo(2.0);
    assertThat(result.get(1).end()).isEqualTo(3.0);
    SegmentSequences.validate(result);
  }

  @Test
  void normalize_shouldFoldContainedSegmentIntoPrevious() {
    List<TranscriptSegment> result =
        SegmentSequences.normalize(
            List.of(
                new TranscriptSegment(0, "outer", 0.0, 5.0, 0.9),
                new TranscriptSegment(1, "inner", 1.0, 2.0, 0.5)));

    assertThat(result).hasSize(1);
    assertThat(result.get(0).text()).isEqualTo("outer inner");
    assertThat(result.get(0).end()).isEqualTo(5.0);
    assertThat(result.get(0).confidence()).isEqualTo(0.5);
  }

  @Test
  void normalize_shouldDropEmptyZeroLengthSegment() {
    List<TranscriptSegment> result =
        SegmentSequences.normalize(
            List.of(
                new TranscriptSegment(0, "", 1.0, 1.0, 0.9),
                new TranscriptSegment(1, "kept", 2.0, 3.0, 0.9)));

    assertThat(result).extracting(TranscriptSegment::text).containsExactly("kept");
  }

  @Test
  void normalize_shouldWidenZeroLengthSegmentWithText() {
    List<TranscriptSegment> result =
        SegmentSequences.normalize(List.of(new TranscriptSegment(0, "hi", 1.0, 1.0, 0.9)));

    assertThat(result).hasSize(1);
    assertThat(result.get(0).end()).isGreaterThan(result.get(0).start());
    SegmentSequences.validate(result);
  }

  @Test
  void validate_shouldRejectOverlappingNeighbours() {
    List<TranscriptSegment> overlapping =
        List.of(
            new TranscriptSegment(0, "a", 0.0, 2.0, 0.9),
            new TranscriptSegment(1, "b", 1.0, 3.0, 0.9));

    assertThatThrownBy(() -> SegmentSequences.validate(overlapping))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Segment 0 ends at");
  }

  @Test
  void validate_shouldRejectIdsOutOfSequence() {
    List<TranscriptSegment> segments = List.of(new TranscriptSegment(3, "a", 0.0, 1.0, 0.9));

    assertThatThrownBy(() -> SegmentSequences.validate(segments))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("has id 3");
  }
}
