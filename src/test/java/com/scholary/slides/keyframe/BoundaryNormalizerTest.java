package com.scholary.slides.keyframe;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.slides.detection.TimeInterval;
import java.util.List;
import org.junit.jupiter.api.Test;

class BoundaryNormalizerTest {

  private static final List<TimeInterval> LECTURE =
      List.of(
          new TimeInterval(0, 2),
          new TimeInterval(2, 5),
          new TimeInterval(5, 40),
          new TimeInterval(40, 42));

  private final BoundaryNormalizer normalizer = new BoundaryNormalizer();

  @Test
  void normalize_shouldUseMidpoints() {
    List<Double> candidates =
        normalizer.normalize(LECTURE, TimeWindow.UNBOUNDED, RepresentativePolicy.MIDPOINT);

    assertThat(candidates).containsExactly(1.0, 3.5, 22.5, 41.0);
  }

  @Test
  void normalize_shouldUseStartsWithStartPolicy() {
    List<Double> candidates =
        normalizer.normalize(LECTURE, TimeWindow.UNBOUNDED, RepresentativePolicy.START);

    assertThat(candidates).containsExactly(0.0, 2.0, 5.0, 40.0);
  }

  @Test
  void normalize_shouldSortAndCollapseDuplicates() {
    List<TimeInterval> unordered =
        List.of(
            new TimeInterval(40, 42),
            new TimeInterval(0, 2),
            new TimeInterval(0, 2),
            new TimeInterval(2, 5));

    List<Double> candidates =
        normalizer.normalize(unordered, TimeWindow.UNBOUNDED, RepresentativePolicy.MIDPOINT);

    assertThat(candidates).containsExactly(1.0, 3.5, 41.0);
  }

  @Test
  void normalize_shouldCollapseRepresentativesWithinOneMillisecond() {
    List<TimeInterval> jittered =
        List.of(new TimeInterval(0, 2), new TimeInterval(0.0004, 2.0004));

    List<Double> candidates =
        normalizer.normalize(jittered, TimeWindow.UNBOUNDED, RepresentativePolicy.MIDPOINT);

    assertThat(candidates).containsExactly(1.0);
  }

  @Test
  void normalize_shouldDiscardRepresentativesOutsideWindow() {
    List<Double> candidates =
        normalizer.normalize(LECTURE, TimeWindow.of(2.0, 30.0), RepresentativePolicy.MIDPOINT);

    assertThat(candidates).containsExactly(3.5, 22.5);
  }

  @Test
  void normalize_shouldReturnEmptyForNoIntervals() {
    assertThat(
            normalizer.normalize(List.of(), TimeWindow.UNBOUNDED, RepresentativePolicy.MIDPOINT))
        .isEmpty();
  }

  @Test
  void normalize_shouldProduceStrictlyIncreasingOutput() {
    List<TimeInterval> overlapping =
        List.of(
            new TimeInterval(10, 30),
            new TimeInterval(0, 40),
            new TimeInterval(5, 6),
            new TimeInterval(19, 21),
            new TimeInterval(1, 2));

    List<Double> candidates =
        normalizer.normalize(overlapping, TimeWindow.UNBOUNDED, RepresentativePolicy.MIDPOINT);

    assertThat(candidates).isSorted().doesNotHaveDuplicates();
    assertThat(candidates).containsExactly(1.5, 5.5, 20.0);
  }
}
