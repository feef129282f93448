package com.scholary.slides.keyframe;

import com.scholary.slides.frame.Frame;
import com.scholary.slides.keyframe.DuplicateFilter.RunningComparison;
import com.scholary.slides.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Final adjacency-based deduplication over materialised frames.
 *
 * <p>Gap filling can place new candidates next to each other that show the same slide. The
 * temporal filter never saw them, so this second duplicate pass runs over the final candidate set.
 * Unreadable frames are dropped because there is nothing to assemble from them.
 *
 * <p>Candidates are sampled one at a time, in order, and a rejected frame is released before the
 * next one is sampled. At most the kept frames plus one candidate are open at any time. Kept
 * frames move into the returned {@link ConsolidatedKeyframes}.
 */
@Component
public class Consolidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(Consolidator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final DuplicateFilter duplicateFilter;

  public Consolidator(DuplicateFilter duplicateFilter) {
    this.duplicateFilter = duplicateFilter;
  }

  /**
   * Sample and consolidate candidates.
   *
   * @param timestamps candidate timestamps in order
   * @param frames source sampled once per candidate
   * @param duplicateThreshold dissimilarity cutoff, 0 disables the duplicate pass
   * @return the ordered keyframes and the timestamps they were kept at
   * @throws NoKeyframesFoundException if there is nothing to consolidate or nothing readable
   */
  public ConsolidatedKeyframes consolidate(
      List<Double> timestamps, FrameSource frames, double duplicateThreshold) {
    if (timestamps.isEmpty()) {
      throw new NoKeyframesFoundException("No keyframe candidates left to consolidate");
    }

    RunningComparison comparison = duplicateFilter.begin(duplicateThreshold, "consolidate");
    List<Keyframe> keyframes = new ArrayList<>();
    List<Double> retained = new ArrayList<>();
    int unreadable = 0;
    try {
      for (double timestamp : timestamps) {
        Frame frame = frames.sampleAt(timestamp).orElse(null);
        if (frame == null || !frame.isReadable()) {
          unreadable++;
        }
        if (comparison.offer(frame)) {
          keyframes.add(new Keyframe(timestamp, frame));
          retained.add(timestamp);
        } else {
          Frame.release(frame);
        }
      }
    } catch (RuntimeException e) {
      keyframes.forEach(keyframe -> keyframe.frame().close());
      throw e;
    }

    structuredLogger.logKeyframesConsolidated(timestamps.size(), keyframes.size(), unreadable);
    if (keyframes.isEmpty()) {
      throw new NoKeyframesFoundException(
          String.format(
              "None of the %d consolidated candidates produced a readable frame",
              timestamps.size()));
    }
    return new ConsolidatedKeyframes(keyframes, retained);
  }
}
