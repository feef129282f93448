package com.scholary.slides.keyframe;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class GapFillerTest {

  private final GapFiller gapFiller = new GapFiller();

  @Test
  void fill_shouldInsertPointsIntoLongGaps() {
    List<Double> filled = gapFiller.fill(List.of(1.0, 3.5, 22.5, 41.0), 10, 5);

    assertThat(filled)
        .containsExactly(1.0, 3.5, 8.5, 13.5, 18.5, 22.5, 27.5, 32.5, 37.5, 41.0);
  }

  @Test
  void fill_shouldLeaveShortGapsAlone() {
    assertThat(gapFiller.fill(List.of(0.0, 10.0), 10, 5)).containsExactly(0.0, 10.0);
  }

  @Test
  void fill_shouldNotDuplicateTheGapEnd() {
    assertThat(gapFiller.fill(List.of(0.0, 10.0), 5, 5)).containsExactly(0.0, 5.0, 10.0);
  }

  @Test
  void fill_shouldSkipPointWithinOneMillisecondOfGapEnd() {
    assertThat(gapFiller.fill(List.of(0.0, 10.0005), 5, 5)).containsExactly(0.0, 5.0, 10.0005);
  }

  @Test
  void fill_shouldBeDisabledByZeroParameters() {
    List<Double> candidates = List.of(0.0, 100.0);

    assertThat(gapFiller.fill(candidates, 0, 5)).isEqualTo(candidates);
    assertThat(gapFiller.fill(candidates, 10, 0)).isEqualTo(candidates);
  }

  @Test
  void fill_shouldLeaveSingleCandidateAlone() {
    assertThat(gapFiller.fill(List.of(3.0), 1, 1)).containsExactly(3.0);
    assertThat(gapFiller.fill(List.of(), 1, 1)).isEmpty();
  }

  @Test
  void fill_shouldKeepOutputStrictlyIncreasingAndBelowGapEnd() {
    List<Double> candidates = List.of(0.0, 7.3, 50.0, 51.0, 130.7);

    List<Double> filled = gapFiller.fill(candidates, 6, 3.3);

    for (int i = 1; i < filled.size(); i++) {
      assertThat(filled.get(i)).isGreaterThan(filled.get(i - 1));
    }
    assertThat(filled).containsAll(candidates);
    assertThat(filled.get(filled.size() - 1)).isEqualTo(130.7);
  }
}
