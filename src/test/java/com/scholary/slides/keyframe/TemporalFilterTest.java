package com.scholary.slides.keyframe;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TemporalFilterTest {

  private ScriptedFrameMetric metric;
  private TemporalFilter filter;
  private FakeFrameSource frames;
  private List<PipelineDiagnostic> diagnostics;
  private ProgressListener listener;

  @BeforeEach
  void setUp() {
    metric = new ScriptedFrameMetric();
    filter = new TemporalFilter(metric, new DuplicateFilter(metric));
    frames = new FakeFrameSource();
    diagnostics = new ArrayList<>();
    listener =
        new ProgressListener() {
          @Override
          public void onProgress(String message) {}

          @Override
          public void onDiagnostic(PipelineDiagnostic diagnostic, double t, String detail) {
            diagnostics.add(diagnostic);
          }
        };
  }

  @Test
  void filter_shouldCoalesceCandidatesCloserThanMinGap() {
    FilterOutcome outcome =
        filter.filter(
            List.of(0.0, 0.5, 1.2, 1.9, 3.0), frames, context(params(0, 0, 1.0)), listener);

    assertThat(outcome.candidates()).containsExactly(0.0, 1.2, 3.0);
    assertThat(outcome.degraded()).isFalse();
    assertThat(frames.requests()).isEmpty();
  }

  @Test
  void filter_shouldDropStaticFrames() {
    metric.sharpness(5.0, 0.5);

    FilterOutcome outcome =
        filter.filter(List.of(1.0, 5.0, 9.0), frames, context(params(2.0, 0, 0.5)), listener);

    assertThat(outcome.candidates()).containsExactly(1.0, 9.0);
  }

  @Test
  void filter_shouldTreatUnreadableFrameAsStatic() {
    frames.unreadableAt(5.0);

    FilterOutcome outcome =
        filter.filter(List.of(1.0, 5.0, 9.0), frames, context(params(2.0, 0, 0.5)), listener);

    assertThat(outcome.candidates()).containsExactly(1.0, 9.0);
  }

  @Test
  void filter_shouldDropDuplicateOfPreviousCandidate() {
    // second frame differs from the first by 0.8 on average
    metric.dissimilarity(12.0, 0.8);

    FilterOutcome outcome =
        filter.filter(List.of(10.0, 12.0, 20.0), frames, context(params(0, 1.5, 0.5)), listener);

    assertThat(outcome.candidates()).containsExactly(10.0, 20.0);
  }

  @Test
  void filter_shouldCompareAgainstLastKeptCandidate() {
    metric.dissimilarity(2.0, 0.5);

    filter.filter(List.of(1.0, 2.0, 3.0), frames, context(params(0, 1.5, 0.5)), listener);

    assertThat(metric.comparisons())
        .extracting(pair -> pair[0] + "->" + pair[1])
        .containsExactly("1.0->2.0", "1.0->3.0");
  }

  @Test
  void filter_shouldFallBackToWindowStartWhenNothingSurvives() {
    KeyframeContext context =
        new KeyframeContext(
            params(0, 0, 0.5), TimeWindow.of(5.0, 50.0), RepresentativePolicy.MIDPOINT, 100.0);

    FilterOutcome outcome = filter.filter(List.of(), frames, context, listener);

    assertThat(outcome.candidates()).containsExactly(5.0);
    assertThat(outcome.degraded()).isTrue();
    assertThat(diagnostics).containsExactly(PipelineDiagnostic.DEGRADED_DETECTION);
  }

  @Test
  void filter_shouldFallBackWhenEveryCandidateIsStatic() {
    FilterOutcome outcome =
        filter.filter(List.of(1.0, 5.0, 9.0), frames, context(params(1e9, 0, 0.5)), listener);

    assertThat(outcome.candidates()).containsExactly(0.0);
    assertThat(outcome.degraded()).isTrue();
  }

  @Test
  void filter_shouldReturnEmptyForZeroLengthVideo() {
    KeyframeContext context =
        new KeyframeContext(params(0, 0, 0.5), null, null, 0.0);

    FilterOutcome outcome = filter.filter(List.of(), frames, context, listener);

    assertThat(outcome.candidates()).isEmpty();
    assertThat(outcome.degraded()).isTrue();
  }

  @Test
  void filter_shouldReturnEmptyWhenWindowStartsAfterVideoEnd() {
    KeyframeContext context =
        new KeyframeContext(params(0, 0, 0.5), TimeWindow.of(200.0, null), null, 100.0);

    FilterOutcome outcome = filter.filter(List.of(), frames, context, listener);

    assertThat(outcome.candidates()).isEmpty();
  }

  @Test
  void filter_shouldRespectMinGapBetweenSurvivors() {
    List<Double> candidates = List.of(0.0, 0.3, 0.9, 1.0, 1.6, 2.05, 2.2, 4.0);

    FilterOutcome outcome =
        filter.filter(candidates, frames, context(params(0, 0, 0.5)), listener);

    List<Double> kept = outcome.candidates();
    for (int i = 1; i < kept.size(); i++) {
      assertThat(kept.get(i) - kept.get(i - 1)).isGreaterThanOrEqualTo(0.5);
    }
  }

  @Test
  void filter_shouldBeIdempotent() {
    metric.sharpness(4.0, 0.1).dissimilarity(7.0, 0.2);
    KeyframeContext context = context(params(2.0, 1.5, 0.5));
    List<Double> candidates = List.of(1.0, 1.2, 4.0, 7.0, 9.0, 9.4, 15.0);

    List<Double> once = filter.filter(candidates, frames, context, listener).candidates();
    List<Double> twice = filter.filter(once, frames, context, listener).candidates();

    assertThat(once).containsExactly(1.0, 9.0, 15.0);
    assertThat(twice).isEqualTo(once);
  }

  @Test
  void filter_shouldReleaseEverySampledFrame() {
    metric.sharpness(4.0, 0.1).dissimilarity(7.0, 0.2);

    filter.filter(
        List.of(1.0, 4.0, 7.0, 9.0), frames, context(params(2.0, 1.5, 0.5)), listener);

    assertThat(frames.requests()).isNotEmpty();
    assertThat(frames.openFrames()).isZero();
  }

  private static FilterParameters params(double staticThreshold, double duplicate, double minGap) {
    return new FilterParameters(12.0, 5, staticThreshold, duplicate, minGap, 0, 0);
  }

  private static KeyframeContext context(FilterParameters parameters) {
    return new KeyframeContext(
        parameters, TimeWindow.UNBOUNDED, RepresentativePolicy.MIDPOINT, 60.0);
  }
}
