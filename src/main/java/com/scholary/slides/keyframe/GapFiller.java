package com.scholary.slides.keyframe;

import com.scholary.slides.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Inserts synthetic candidates into over-long gaps between kept candidates.
 *
 * <p>Scene detectors tuned for motion miss transitions between visually similar slides, such as
 * incremental bullet reveals. Periodic sampling inside long static stretches recovers those
 * without re-running detection.
 *
 * <p>Example with {@code maxTimeGap=10} and {@code fillInterval=5}:
 *
 * <pre>
 * in:  22.5, 41.0
 * out: 22.5, 27.5, 32.5, 37.5, 41.0
 * </pre>
 */
@Component
public class GapFiller {

  private static final Logger LOGGER = LoggerFactory.getLogger(GapFiller.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /**
   * Fill gaps wider than {@code maxTimeGap}.
   *
   * <p>For each adjacent pair {@code (a, b)} points {@code a + k * fillInterval} are inserted
   * while they stay below {@code b}; a point within a millisecond of {@code b} counts as {@code b}
   * and is skipped. Insertion happens segment by segment, so the result is already ordered.
   *
   * @param candidates strictly increasing candidates
   * @param maxTimeGap gap threshold in seconds, 0 or less disables filling
   * @param fillInterval spacing of synthetic points, 0 or less disables filling
   * @return a new strictly increasing sequence
   */
  public List<Double> fill(List<Double> candidates, double maxTimeGap, double fillInterval) {
    if (maxTimeGap <= 0 || fillInterval <= 0 || candidates.size() < 2) {
      return new ArrayList<>(candidates);
    }

    List<Double> filled = new ArrayList<>(candidates.size());
    int insertedTotal = 0;
    for (int i = 0; i < candidates.size(); i++) {
      double start = candidates.get(i);
      filled.add(start);
      if (i + 1 == candidates.size()) {
        break;
      }
      double end = candidates.get(i + 1);
      if (end - start <= maxTimeGap) {
        continue;
      }
      int inserted = 0;
      for (int k = 1; ; k++) {
        double point = start + k * fillInterval;
        if (point >= end || Timestamps.same(point, end)) {
          break;
        }
        filled.add(point);
        inserted++;
      }
      structuredLogger.logGapFilled(start, end, inserted);
      insertedTotal += inserted;
    }

    LOGGER.info(
        "Gap filling inserted {} candidates (maxGap={}s, interval={}s)",
        insertedTotal,
        maxTimeGap,
        fillInterval);
    return filled;
  }
}
