package com.scholary.slides.keyframe;

import com.scholary.slides.frame.Frame;
import com.scholary.slides.frame.FrameMetric;
import com.scholary.slides.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Running-comparison duplicate detection.
 *
 * <p>Every decision is made against the nearest surviving predecessor, not against all earlier
 * frames. That is what collapses slow fades and repeated cuts of the same slide into a single
 * representative.
 *
 * <p>The same comparison backs both duplicate passes of the pipeline: the one inside the {@link
 * TemporalFilter} and the final one in the {@link Consolidator}.
 */
@Component
public class DuplicateFilter {

  private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateFilter.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final FrameMetric frameMetric;

  public DuplicateFilter(FrameMetric frameMetric) {
    this.frameMetric = frameMetric;
  }

  /**
   * Start a left-to-right pass.
   *
   * @param threshold dissimilarity below which a frame is a duplicate; 0 keeps every readable frame
   * @param stage stage name used in logs
   * @return a fresh comparison with no reference frame
   */
  public RunningComparison begin(double threshold, String stage) {
    return new RunningComparison(threshold, stage);
  }

  /**
   * One pass over an ordered frame sequence.
   *
   * <p>The comparison only references frames, it never closes them. Callers keep the last kept
   * frame open until {@link #offer} accepts a newer one.
   */
  public final class RunningComparison {

    private final double threshold;
    private final String stage;
    private Frame lastKept;

    private RunningComparison(double threshold, String stage) {
      this.threshold = threshold;
      this.stage = stage;
    }

    /**
     * Decide on the next frame in order.
     *
     * <p>Unreadable frames are always rejected and never become the reference. The first readable
     * frame is always kept.
     *
     * @param candidate the next frame, may be null
     * @return true if the frame is kept and is now the reference
     */
    public boolean offer(Frame candidate) {
      if (candidate == null || !candidate.isReadable()) {
        return false;
      }
      if (lastKept == null || threshold <= 0) {
        lastKept = candidate;
        return true;
      }
      double score = frameMetric.dissimilarity(lastKept, candidate);
      if (score < threshold) {
        structuredLogger.logCandidateDropped(stage, candidate.timestamp(), score, threshold);
        return false;
      }
      lastKept = candidate;
      return true;
    }
  }
}
