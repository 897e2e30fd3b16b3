package com.scholary.transcriber.transcript;

import com.scholary.transcriber.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Assigns diarization speakers to recognition segments.
 *
 * <p>Recognition and diarization cut the timeline independently, so a transcript segment may sit
 * inside one speaker turn, mostly inside one, or genuinely straddle a change of speaker. The
 * merger handles the three cases as follows:
 *
 * <ol>
 *   <li>Overlap is summed per speaker across every turn intersecting the segment.
 *   <li>No overlap: the segment stays unlabeled (a silence gap in the diarization output).
 *   <li>Majority overlap: a single speaker, or one whose share of the segment reaches the
 *       dominance threshold, labels the whole segment.
 *   <li>Straddle: the segment is split where the speaker changes and each part is assigned again
 *       on its own, shorter interval.
 * </ol>
 *
 * <p>The change point between two consecutive turns of different speakers is the midpoint of the
 * earlier turn's end and the later turn's start, which covers both gaps and crosstalk. With word
 * timings the split happens at the word boundary nearest that point; without them the segment is
 * cut at the point itself and its text tokens are divided in proportion to time. The output is
 * normalized, renumbered and checked against the ordering invariant whatever the input looked
 * like. The algorithm is deterministic: the same input always yields the same output.
 */
@Component
public class DiarizationMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiarizationMerger.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final double EPSILON = 1e-9;

  private static final Comparator<SpeakerTurn> TURN_ORDER =
      Comparator.comparingDouble(SpeakerTurn::start)
          .thenComparingDouble(SpeakerTurn::end)
          .thenComparing(SpeakerTurn::speaker, Comparator.nullsFirst(Comparator.naturalOrder()));

  private final MergeProperties properties;

  public DiarizationMerger(MergeProperties properties) {
    this.properties = properties;
  }

  /**
   * Merge speaker turns into transcript segments.
   *
   * @param segments recognition output on the full-file timeline
   * @param turns diarization output on the same timeline
   * @return labeled segments, possibly more than were passed in, renumbered from 0
   */
  public List<TranscriptSegment> merge(List<TranscriptSegment> segments, List<SpeakerTurn> turns) {
    List<SpeakerTurn> orderedTurns =
        turns.stream()
            .filter(t -> t.speaker() != null && t.end() - t.start() > EPSILON)
            .sorted(TURN_ORDER)
            .toList();

    List<TranscriptSegment> input = SegmentSequences.normalize(segments);
    List<TranscriptSegment> assigned = new ArrayList<>(input.size());
    for (TranscriptSegment segment : input) {
      assign(segment, orderedTurns, 0, assigned);
    }

    List<TranscriptSegment> merged = SegmentSequences.normalize(assigned);
    SegmentSequences.validate(merged);

    long unlabeled = merged.stream().filter(s -> s.speaker() == null).count();
    structuredLogger.logMergeSummary(
        input.size(), orderedTurns.size(), merged.size(), merged.size() - input.size(), unlabeled);
    return merged;
  }

  private void assign(
      TranscriptSegment segment, List<SpeakerTurn> turns, int depth, List<TranscriptSegment> out) {
    List<SpeakerTurn> intersecting = intersecting(segment, turns);
    if (intersecting.isEmpty()) {
      out.add(segment.withSpeaker(null));
      return;
    }

    // TreeMap keeps speaker iteration order stable, which makes tie-breaks deterministic
    Map<String, Double> overlapBySpeaker = new TreeMap<>();
    for (SpeakerTurn turn : intersecting) {
      overlapBySpeaker.merge(
          turn.speaker(), turn.overlapWith(segment.start(), segment.end()), Double::sum);
    }
    String topSpeaker = topSpeaker(overlapBySpeaker);
    double share = overlapBySpeaker.get(topSpeaker) / segment.duration();

    if (overlapBySpeaker.size() == 1
        || share >= properties.dominanceThreshold() - EPSILON
        || depth >= properties.maxSplitDepth()) {
      out.add(segment.withSpeaker(topSpeaker));
      return;
    }

    OptionalDouble changePoint = changePoint(segment, intersecting);
    if (changePoint.isEmpty()) {
      out.add(segment.withSpeaker(topSpeaker));
      return;
    }

    List<TranscriptSegment> parts = split(segment, changePoint.getAsDouble());
    if (parts.size() < 2) {
      out.add(segment.withSpeaker(topSpeaker));
      return;
    }

    LOGGER.debug(
        "Splitting segment {} [{}-{}] at {} (top speaker {} covers {}%)",
        segment.id(),
        segment.start(),
        segment.end(),
        parts.get(1).start(),
        topSpeaker,
        Math.round(share * 100));
    for (TranscriptSegment part : parts) {
      assign(part, turns, depth + 1, out);
    }
  }

  private static List<SpeakerTurn> intersecting(
      TranscriptSegment segment, List<SpeakerTurn> turns) {
    List<SpeakerTurn> result = new ArrayList<>();
    for (SpeakerTurn turn : turns) {
      if (turn.start() >= segment.end()) {
        break;
      }
      if (turn.overlapWith(segment.start(), segment.end()) > EPSILON) {
        result.add(turn);
      }
    }
    return result;
  }

  private static String topSpeaker(Map<String, Double> overlapBySpeaker) {
    String best = null;
    double bestOverlap = -1.0;
    for (Map.Entry<String, Double> entry : overlapBySpeaker.entrySet()) {
      if (entry.getValue() > bestOverlap + EPSILON) {
        best = entry.getKey();
        bestOverlap = entry.getValue();
      }
    }
    return best;
  }

  /** First speaker change strictly inside the segment that leaves room for two parts. */
  private OptionalDouble changePoint(TranscriptSegment segment, List<SpeakerTurn> intersecting) {
    double minPart = Math.max(properties.minSegmentSeconds(), EPSILON);
    for (int i = 1; i < intersecting.size(); i++) {
      SpeakerTurn previous = intersecting.get(i - 1);
      SpeakerTurn next = intersecting.get(i);
      if (previous.speaker().equals(next.speaker())) {
        continue;
      }
      double point = (previous.end() + next.start()) / 2.0;
      if (point - segment.start() >= minPart && segment.end() - point >= minPart) {
        return OptionalDouble.of(point);
      }
    }
    return OptionalDouble.empty();
  }

  private List<TranscriptSegment> split(TranscriptSegment segment, double point) {
    if (properties.wordBoundarySplit() && segment.words().size() >= 2) {
      List<TranscriptSegment> byWords = splitAtWordBoundary(segment, point);
      if (byWords.size() == 2) {
        return byWords;
      }
    }
    return splitAtPoint(segment, point);
  }

  private List<TranscriptSegment> splitAtWordBoundary(TranscriptSegment segment, double point) {
    List<Word> words = segment.words();
    double minPart = Math.max(properties.minSegmentSeconds(), EPSILON);

    int bestIndex = -1;
    double bestDistance = Double.MAX_VALUE;
    for (int k = 1; k < words.size(); k++) {
      double boundary = words.get(k).start();
      if (boundary - segment.start() < minPart || segment.end() - boundary < minPart) {
        continue;
      }
      double distance = Math.abs(boundary - point);
      if (distance < bestDistance - EPSILON) {
        bestDistance = distance;
        bestIndex = k;
      }
    }
    if (bestIndex < 0) {
      return List.of(segment);
    }

    double boundary = words.get(bestIndex).start();
    List<Word> leftWords = words.subList(0, bestIndex);
    List<Word> rightWords = words.subList(bestIndex, words.size());
    return List.of(
        part(segment, segment.start(), boundary, joinWords(leftWords), leftWords),
        part(segment, boundary, segment.end(), joinWords(rightWords), rightWords));
  }

  private static List<TranscriptSegment> splitAtPoint(TranscriptSegment segment, double point) {
    String[] tokens = segment.text().strip().split("\\s+");
    if (tokens.length < 2) {
      return List.of(segment);
    }

    double fraction = (point - segment.start()) / segment.duration();
    int leftCount = (int) Math.round(tokens.length * fraction);
    leftCount = Math.max(1, Math.min(tokens.length - 1, leftCount));

    String leftText = String.join(" ", List.of(tokens).subList(0, leftCount));
    String rightText = String.join(" ", List.of(tokens).subList(leftCount, tokens.length));

    List<Word> leftWords = new ArrayList<>();
    List<Word> rightWords = new ArrayList<>();
    for (Word word : segment.words()) {
      if (word.start() < point) {
        leftWords.add(word);
      } else {
        rightWords.add(word);
      }
    }

    return List.of(
        part(segment, segment.start(), point, leftText, leftWords),
        part(segment, point, segment.end(), rightText, rightWords));
  }

  private static TranscriptSegment part(
      TranscriptSegment source, double start, double end, String text, List<Word> words) {
    return new TranscriptSegment(
        source.id(), text, start, end, source.confidence(), source.speaker(), words);
  }

  private static String joinWords(List<Word> words) {
    return words.stream()
        .map(w -> w.text().strip())
        .filter(t -> !t.isEmpty())
        .collect(Collectors.joining(" "));
  }
}
