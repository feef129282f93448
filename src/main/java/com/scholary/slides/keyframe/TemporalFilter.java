package com.scholary.slides.keyframe;

import com.scholary.slides.frame.Frame;
import com.scholary.slides.frame.FrameMetric;
import com.scholary.slides.keyframe.DuplicateFilter.RunningComparison;
import com.scholary.slides.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Removes candidates that are too close, too noisy, or repeats of their predecessor.
 *
 * <p>Three single left-to-right passes, in this order:
 *
 * <ol>
 *   <li>Gap coalescing: drop a candidate closer than {@code minTimeGap} to the last kept one.
 *   <li>Static filtering: drop a candidate whose frame sharpness is below {@code staticThreshold}.
 *   <li>Duplicate filtering: drop a candidate whose frame is within {@code duplicateThreshold} of
 *       the last kept frame.
 * </ol>
 *
 * <p>Each frame-based pass samples its own frames and releases them before returning.
 *
 * <p>If nothing survives, the outcome is a single fallback candidate at the window start, flagged
 * as degraded. No fallback is possible for a zero-length video or a window that starts past the
 * end of the video; the outcome is then empty.
 */
@Component
public class TemporalFilter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TemporalFilter.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final FrameMetric frameMetric;
  private final DuplicateFilter duplicateFilter;

  public TemporalFilter(FrameMetric frameMetric, DuplicateFilter duplicateFilter) {
    this.frameMetric = frameMetric;
    this.duplicateFilter = duplicateFilter;
  }

  /**
   * Filter the initial candidate sequence.
   *
   * @param candidates strictly increasing candidates from the normalizer
   * @param frames frame source bound to the video of this run
   * @param context run parameters, window and duration
   * @param listener diagnostic channel
   * @return the surviving candidates, or the fallback candidate
   */
  public FilterOutcome filter(
      List<Double> candidates,
      FrameSource frames,
      KeyframeContext context,
      ProgressListener listener) {
    FilterParameters parameters = context.parameters();

    List<Double> kept = coalesceGaps(candidates, parameters.minTimeGap());
    if (parameters.staticFilteringEnabled()) {
      kept = dropStatic(kept, frames, parameters.staticThreshold());
    }
    if (parameters.duplicateFilteringEnabled()) {
      kept = dropDuplicates(kept, frames, parameters.duplicateThreshold());
    }

    LOGGER.info("Temporal filter kept {} of {} candidates", kept.size(), candidates.size());
    if (kept.isEmpty()) {
      return fallback(candidates.size(), context, listener);
    }
    return new FilterOutcome(kept, false);
  }

  /**
   * Drop candidates closer than {@code minTimeGap} to the previously kept candidate.
   *
   * <p>The first candidate is always kept. Needs no frames, so the candidate preview uses it too.
   */
  public List<Double> coalesceGaps(List<Double> candidates, double minTimeGap) {
    List<Double> kept = new ArrayList<>(candidates.size());
    for (double candidate : candidates) {
      if (!kept.isEmpty()) {
        double gap = candidate - kept.get(kept.size() - 1);
        if (gap < minTimeGap) {
          structuredLogger.logCandidateDropped("gap", candidate, gap, minTimeGap);
          continue;
        }
      }
      kept.add(candidate);
    }
    return kept;
  }

  private List<Double> dropStatic(List<Double> candidates, FrameSource frames, double threshold) {
    List<Double> kept = new ArrayList<>(candidates.size());
    for (double candidate : candidates) {
      double score;
      try (Frame frame = frames.sampleAt(candidate).orElse(null)) {
        score = frameMetric.sharpness(frame);
      }
      if (score < threshold) {
        structuredLogger.logCandidateDropped("static", candidate, score, threshold);
        continue;
      }
      kept.add(candidate);
    }
    return kept;
  }

  private List<Double> dropDuplicates(
      List<Double> candidates, FrameSource frames, double threshold) {
    List<Double> kept = new ArrayList<>(candidates.size());
    RunningComparison comparison = duplicateFilter.begin(threshold, "duplicate");
    Frame reference = null;
    try {
      for (double candidate : candidates) {
        Frame frame = frames.sampleAt(candidate).orElse(null);
        if (comparison.offer(frame)) {
          kept.add(candidate);
          Frame.release(reference);
          reference = frame;
        } else {
          Frame.release(frame);
        }
      }
    } finally {
      Frame.release(reference);
    }
    return kept;
  }

  private FilterOutcome fallback(
      int candidatesIn, KeyframeContext context, ProgressListener listener) {
    double fallback = context.window().start();
    Double duration = context.videoDurationSeconds();
    if (duration != null && (duration <= 0 || fallback > duration)) {
      LOGGER.warn(
          "No candidate survived and no fallback is possible: windowStart={}s, duration={}s",
          fallback,
          duration);
      listener.onProgress("No usable candidate and the video offers no fallback frame.");
      return new FilterOutcome(List.of(), true);
    }
    structuredLogger.logDegradedDetection(candidatesIn, fallback);
    listener.onDiagnostic(
        PipelineDiagnostic.DEGRADED_DETECTION,
        fallback,
        "no scene change survived filtering, using a single frame");
    return new FilterOutcome(List.of(fallback), true);
  }
}
