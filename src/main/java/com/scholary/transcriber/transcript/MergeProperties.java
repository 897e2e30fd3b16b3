package com.scholary.transcriber.transcript;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning for {@link DiarizationMerger}.
 *
 * @param dominanceThreshold share of a segment one speaker must cover to win it outright
 * @param wordBoundarySplit split straddling segments at word boundaries when word timings exist;
 *     false always uses the time midpoint
 * @param maxSplitDepth how many times a segment may be split recursively
 * @param minSegmentSeconds no split produces a part shorter than this
 */
@ConfigurationProperties(prefix = "merge")
@Validated
public record MergeProperties(
    @DecimalMin("0.5") @DecimalMax("1.0") double dominanceThreshold,
    boolean wordBoundarySplit,
    @Positive int maxSplitDepth,
    @PositiveOrZero double minSegmentSeconds) {

  public static MergeProperties defaults() {
    return new MergeProperties(0.8, true, 8, 0.2);
  }
}
