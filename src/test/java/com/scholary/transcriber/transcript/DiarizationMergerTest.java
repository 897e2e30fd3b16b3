package com.scholary.transcriber.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class DiarizationMergerTest {

  private final DiarizationMerger merger = new DiarizationMerger(MergeProperties.defaults());

  @Test
  void merge_shouldLabelSegmentInsideSingleTurn() {
    List<TranscriptSegment> result =
        merger.merge(
            List.of(new TranscriptSegment(0, "hello world", 0.0, 4.0, 0.9)),
            List.of(new SpeakerTurn(0.0, 5.0, "SPEAKER_00")));

    assertThat(result).hasSize(1);
    assertThat(result.get(0).speaker()).isEqualTo("SPEAKER_00");
    assertThat(result.get(0).text()).isEqualTo("hello world");
  }

  @Test
  void merge_shouldLeaveSegmentInSilenceGapUnlabeled() {
    List<TranscriptSegment> result =
        merger.merge(
            List.of(new TranscriptSegment(0, "noise", 10.0, 12.0, 0.9)),
            List.of(new SpeakerTurn(0.0, 5.0, "SPEAKER_00")));

    assertThat(result).hasSize(1);
    assertThat(result.get(0).speaker()).isNull();
  }

  @Test
  void merge_shouldGiveWholeSegmentToDominantSpeaker() {
    List<TranscriptSegment> result =
        merger.merge(
            List.of(new TranscriptSegment(0, "mostly one voice", 0.0, 10.0, 0.9)),
            List.of(new SpeakerTurn(0.0, 9.0, "A"), new SpeakerTurn(9.0, 12.0, "B")));

    assertThat(result).hasSize(1);
    assertThat(result.get(0).speaker()).isEqualTo("A");
  }

  @Test
  void merge_shouldSplitStraddlingSegmentByTimeWithoutWords() {
    List<TranscriptSegment> result =
        merger.merge(
            List.of(
                new TranscriptSegment(
                    0, "one two three four five six seven eight nine ten", 0.0, 10.0, 0.9)),
            List.of(new SpeakerTurn(0.0, 5.0, "A"), new SpeakerTurn(5.0, 10.0, "B")));

    assertThat(result).hasSize(2);
    assertThat(result.get(0).text()).isEqualTo("one two three four five");
    assertThat(result.get(0).speaker()).isEqualTo("A");
    assertThat(result.get(0).end()).isEqualTo(5.0);
    assertThat(result.get(1).text()).isEqualTo("six seven eight nine ten");
    assertThat(result.get(1).speaker()).isEqualTo("B");
    assertThat(result).extracting(TranscriptSegment::id).containsExactly(0, 1);
  }

  @Test
  void merge_shouldSplitAtNearestWordBoundary() {
    List<Word> words =
        List.of(
            new Word("a", 0.0, 1.0, 0.9),
            new Word("b", 1.0, 2.0, 0.9),
            new Word("c", 2.0, 3.0, 0.9),
            new Word("d", 3.0, 4.0, 0.9));
    TranscriptSegment segment = new TranscriptSegment(0, "a b c d", 0.0, 4.0, 0.9, null, words);

    List<TranscriptSegment> result =
        merger.merge(
            List.of(segment),
            List.of(new SpeakerTurn(0.0, 2.2, "A"), new SpeakerTurn(2.4, 4.0, "B")));

    assertThat(result).hasSize(2);
    assertThat(result.get(0).text()).isEqualTo("a b");
    assertThat(result.get(0).end()).isEqualTo(2.0);
    assertThat(result.get(0).words()).hasSize(2);
    assertThat(result.get(0).speaker()).isEqualTo("A");
    assertThat(result.get(1).text()).isEqualTo("c d");
    assertThat(result.get(1).start()).isEqualTo(2.0);
    assertThat(result.get(1).speaker()).isEqualTo("B");
  }

  @Test
  void merge_shouldSplitCrosstalkAtMidpointOfChange() {
    List<TranscriptSegment> result =
        merger.merge(
            List.of(new TranscriptSegment(0, "w1 w2 w3 w4 w5 w6 w7 w8 w9 w10", 0.0, 10.0, 0.9)),
            List.of(new SpeakerTurn(0.0, 6.0, "A"), new SpeakerTurn(4.0, 10.0, "B")));

    assertThat(result).extracting(TranscriptSegment::speaker).containsExactly("A", "B");
    assertThat(result.get(0).end()).isEqualTo(5.0);
  }

  @Test
  void merge_shouldProduceOrderedSequenceFromOverlappingInput() {
    List<TranscriptSegment> result =
        merger.merge(
            List.of(
                new TranscriptSegment(0, "late", 2.0, 5.0, 0.9),
                new TranscriptSegment(1, "early", 0.0, 3.0, 0.9)),
            List.of(new SpeakerTurn(0.0, 5.0, "A")));

    SegmentSequences.validate(result);
    assertThat(result).extracting(TranscriptSegment::text).containsExactly("early", "late");
    assertThat(result).allMatch(s -> "A".equals(s.speaker()));
  }

  @Test
  void merge_shouldBeDeterministic() {
    List<TranscriptSegment> segments =
        List.of(
            new TranscriptSegment(0, "one two three four", 0.0, 4.0, 0.9),
            new TranscriptSegment(1, "five six", 4.0, 6.0, 0.8));
    List<SpeakerTurn> turns =
        List.of(
            new SpeakerTurn(0.0, 2.0, "B"),
            new SpeakerTurn(2.0, 4.5, "A"),
            new SpeakerTurn(4.5, 6.0, "B"));

    assertThat(merger.merge(segments, turns)).isEqualTo(merger.merge(segments, turns));
  }

  @Test
  void merge_shouldKeepSegmentsWhenNoTurns() {
    List<TranscriptSegment> result =
        merger.merge(List.of(new TranscriptSegment(0, "alone", 0.0, 1.0, 0.9)), List.of());

    assertThat(result).hasSize(1);
    assertThat(result.get(0).speaker()).isNull();
  }
}
