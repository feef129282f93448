package com.scholary.slides.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.slides.api.ExtractionRequest;
import com.scholary.slides.detection.DetectionMethod;
import com.scholary.slides.keyframe.CancellationToken;
import com.scholary.slides.keyframe.ExtractionCancelledException;
import com.scholary.slides.keyframe.FilterParameters;
import com.scholary.slides.keyframe.InvalidParametersException;
import com.scholary.slides.keyframe.NoKeyframesFoundException;
import com.scholary.slides.keyframe.RepresentativePolicy;
import com.scholary.slides.keyframe.StageCounts;
import com.scholary.slides.keyframe.TimeWindow;
import com.scholary.slides.media.CropRegion;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ParameterSweepServiceTest {

  private static final Path OUTPUT = Path.of("/out/sweep");

  private KeyframeExtractionService extractionService;
  private ParameterSweepService sweepService;
  private ExtractionRequest request;

  @BeforeEach
  void setUp() {
    extractionService = mock(KeyframeExtractionService.class);
    sweepService = new ParameterSweepService(extractionService);
    request = ExtractionRequest.of("/videos/lecture.mp4", OUTPUT.toString());
    when(extractionService.plan(request))
        .thenReturn(
            new ExtractionPlan(
                Path.of("/videos/lecture.mp4"),
                OUTPUT,
                CropRegion.FULL,
                TimeWindow.UNBOUNDED,
                FilterParameters.defaults(),
                DetectionMethod.SCENE_CONTENT,
                RepresentativePolicy.MIDPOINT,
                false));
  }

  @Test
  void presetNames_shouldListAllPresetsInOrder() {
    assertThat(sweepService.presetNames())
        .hasSize(8)
        .startsWith("01_default")
        .endsWith("08_no_fill");
  }

  @Test
  void sweep_shouldRunEachPresetInItsOwnDirectoryAndSortByCount() throws Exception {
    when(extractionService.execute(any(), any(), any()))
        .thenAnswer(
            invocation -> {
              ExtractionPlan plan = invocation.getArgument(0);
              int count = plan.parameters().boundarySensitivity() < 10 ? 9 : 4;
              return report(count);
            });

    List<SweepOutcome> outcomes =
        sweepService.sweep(
            request, List.of("01_default", "02_sensitive"), CancellationToken.NONE);

    assertThat(outcomes)
        .extracting(SweepOutcome::preset)
        .containsExactly("02_sensitive", "01_default");
    assertThat(outcomes).extracting(SweepOutcome::keyframeCount).containsExactly(9, 4);
    assertThat(outcomes.get(0).outputDirectory())
        .isEqualTo(OUTPUT.resolve("02_sensitive").toString());
    assertThat(outcomes).allMatch(SweepOutcome::succeeded);
  }

  @Test
  void sweep_shouldRecordFailedPresetAndContinue() throws Exception {
    when(extractionService.execute(any(), any(), any()))
        .thenAnswer(
            invocation -> {
              ExtractionPlan plan = invocation.getArgument(0);
              if (plan.outputDirectory().endsWith("05_conservative")) {
                throw new NoKeyframesFoundException("nothing left");
              }
              return report(3);
            });

    List<SweepOutcome> outcomes = sweepService.sweep(request, List.of(), CancellationToken.NONE);

    assertThat(outcomes).hasSize(8);
    SweepOutcome last = outcomes.get(outcomes.size() - 1);
    assertThat(last.preset()).isEqualTo("05_conservative");
    assertThat(last.keyframeCount()).isEqualTo(-1);
    assertThat(last.error()).isEqualTo("nothing left");
    assertThat(last.succeeded()).isFalse();
  }

  @Test
  void sweep_shouldRejectUnknownPresetBeforeRunning() throws Exception {
    assertThatThrownBy(
            () -> sweepService.sweep(request, List.of("99_missing"), CancellationToken.NONE))
        .isInstanceOf(InvalidParametersException.class)
        .hasMessageContaining("99_missing");
    verify(extractionService, never()).execute(any(), any(), any());
  }

  @Test
  void sweep_shouldStopOnCancellation() throws Exception {
    when(extractionService.execute(any(), any(), any()))
        .thenThrow(new ExtractionCancelledException("stop"));

    assertThatThrownBy(() -> sweepService.sweep(request, null, CancellationToken.NONE))
        .isInstanceOf(ExtractionCancelledException.class);
  }

  private static ExtractionReport report(int count) {
    List<Double> timestamps = IntStream.range(0, count).mapToObj(i -> i * 10.0).toList();
    List<String> pages = timestamps.stream().map(t -> "page_" + t + ".png").toList();
    return new ExtractionReport(
        timestamps, pages, List.of(), false, new StageCounts(count, count, count, count, count));
  }
}
