package com.scholary.slides.keyframe;

import com.scholary.slides.detection.TimeInterval;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keyframe selection pipeline.
 *
 * <p>Turns detector intervals into an ordered, deduplicated list of slide frames:
 *
 * <ol>
 *   <li>{@link BoundaryNormalizer}: intervals to sorted candidate timestamps.
 *   <li>{@link TemporalFilter}: gap, static and duplicate filtering, with single-frame fallback.
 *   <li>{@link GapFiller}: synthetic candidates inside long gaps.
 *   <li>{@link Consolidator}: one frame per candidate, final adjacency-based deduplication.
 * </ol>
 *
 * <p>Stages only exchange timestamp lists. Frames are sampled by the stage that needs them and
 * released there, except for the final frames which move into the returned {@link
 * KeyframeResult}.
 */
@Component
public class KeyframePipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeyframePipeline.class);

  private final BoundaryNormalizer normalizer;
  private final TemporalFilter temporalFilter;
  private final GapFiller gapFiller;
  private final Consolidator consolidator;

  public KeyframePipeline(
      BoundaryNormalizer normalizer,
      TemporalFilter temporalFilter,
      GapFiller gapFiller,
      Consolidator consolidator) {
    this.normalizer = normalizer;
    this.temporalFilter = temporalFilter;
    this.gapFiller = gapFiller;
    this.consolidator = consolidator;
  }

  /**
   * Run the full selection.
   *
   * @param intervals detector output
   * @param frames frame source bound to the video
   * @param context tuning, window, policy and duration
   * @param listener progress and diagnostic channel
   * @param cancellation polled before every frame sample
   * @return the consolidated keyframes; the caller owns and must close the result
   * @throws NoKeyframesFoundException if no readable keyframe remains
   * @throws ExtractionCancelledException if the token trips during the run
   */
  public KeyframeResult run(
      List<TimeInterval> intervals,
      FrameSource frames,
      KeyframeContext context,
      ProgressListener listener,
      CancellationToken cancellation) {
    FrameSource guarded = new GuardedFrameSource(frames, listener, cancellation);
    FilterParameters parameters = context.parameters();

    List<Double> normalized =
        normalizer.normalize(intervals, context.window(), context.policy());
    listener.onProgress(String.format("Normalized %d candidates", normalized.size()));

    FilterOutcome filtered = temporalFilter.filter(normalized, guarded, context, listener);
    listener.onProgress(String.format("Filtering kept %d candidates", filtered.size()));

    List<Double> filled =
        gapFiller.fill(filtered.candidates(), parameters.maxTimeGap(), parameters.fillInterval());
    listener.onProgress(String.format("Sampling %d candidates", filled.size()));

    ConsolidatedKeyframes keyframes =
        consolidator.consolidate(filled, guarded, parameters.duplicateThreshold());
    listener.onProgress(String.format("Consolidated %d keyframes", keyframes.size()));

    StageCounts counts =
        new StageCounts(
            intervals.size(), normalized.size(), filtered.size(), filled.size(), keyframes.size());
    LOGGER.info("Keyframe pipeline finished: {}", counts);
    return new KeyframeResult(keyframes, filtered.degraded(), counts);
  }

  /**
   * Compute the candidate timeline without sampling any frame.
   *
   * @param intervals detector output
   * @param context tuning, window and policy
   * @return candidates after normalization, coalescing and gap filling
   */
  public CandidateTimeline preview(List<TimeInterval> intervals, KeyframeContext context) {
    FilterParameters parameters = context.parameters();
    List<Double> normalized =
        normalizer.normalize(intervals, context.window(), context.policy());
    List<Double> coalesced = temporalFilter.coalesceGaps(normalized, parameters.minTimeGap());
    List<Double> filled =
        gapFiller.fill(coalesced, parameters.maxTimeGap(), parameters.fillInterval());
    return new CandidateTimeline(normalized, coalesced, filled);
  }
}
