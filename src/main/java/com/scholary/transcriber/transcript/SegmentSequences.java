package com.scholary.transcriber.transcript;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordering rules shared by every producer of a segment sequence.
 *
 * <p>A completed result must have segments sorted by start with {@code end > start} and no
 * overlap between neighbours. Recognizers and the merger both go through {@link #normalize} and
 * the merger additionally asserts {@link #validate} before handing its output on.
 */
public final class SegmentSequences {

  /** Degenerate segments that still carry text get this much room instead of being dropped. */
  static final double MIN_DURATION_SECONDS = 0.01;

  private static final double EPSILON = 1e-9;

  private static final Comparator<TranscriptSegment> ORDER =
      Comparator.comparingDouble(TranscriptSegment::start)
          .thenComparingDouble(TranscriptSegment::end)
          .thenComparingInt(TranscriptSegment::id);

  private SegmentSequences() {}

  /**
   * Sort, clamp overlaps and renumber.
   *
   * <ol>
   *   <li>Segments are sorted by (start, end, id).
   *   <li>A segment starting before its predecessor ends is moved to start at that end.
   *   <li>A segment left with no length is folded into its predecessor when it overlapped it,
   *       given a minimal length when it did not, and dropped when it has no text at all.
   *   <li>Ids are reassigned 0..n-1.
   * </ol>
   */
  public static List<TranscriptSegment> normalize(List<TranscriptSegment> segments) {
    List<TranscriptSegment> sorted = new ArrayList<>(segments);
    sorted.sort(ORDER);

    List<TranscriptSegment> out = new ArrayList<>(sorted.size());
    for (TranscriptSegment segment : sorted) {
      double start = segment.start();
      double end = segment.end();
      TranscriptSegment previous = out.isEmpty() ? null : out.get(out.size() - 1);
      if (previous != null && start < previous.end()) {
        start = previous.end();
      }

      if (end - start > EPSILON) {
        out.add(segment.withBounds(start, end));
        continue;
      }

      if (segment.text().isBlank() && !segment.hasWords()) {
        continue;
      }
      if (previous != null && segment.start() < previous.end() + EPSILON) {
        out.set(out.size() - 1, previous.absorb(segment));
      } else {
        out.add(segment.withBounds(start, start + MIN_DURATION_SECONDS));
      }
    }

    return renumber(out);
  }

  public static List<TranscriptSegment> renumber(List<TranscriptSegment> segments) {
    List<TranscriptSegment> renumbered = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      renumbered.add(segments.get(i).withId(i));
    }
    return renumbered;
  }

  /**
   * Check the ordering invariant of a finished sequence.
   *
   * @throws IllegalStateException naming the first offending segment
   */
  public static void validate(List<TranscriptSegment> segments) {
    for (int i = 0; i < segments.size(); i++) {
      TranscriptSegment segment = segments.get(i);
      if (segment.id() != i) {
        throw new IllegalStateException(
            String.format("Segment at position %d has id %d", i, segment.id()));
      }
      if (!(segment.end() > segment.start())) {
        throw new IllegalStateException(
            String.format(
                "Segment %d has non-positive duration [%.3f, %.3f]",
                i, segment.start(), segment.end()));
      }
      if (i + 1 < segments.size() && segment.end() > segments.get(i + 1).start()) {
        throw new IllegalStateException(
            String.format(
                "Segment %d ends at %.3f after segment %d starts at %.3f",
                i, segment.end(), i + 1, segments.get(i + 1).start()));
      }
    }
  }
}
