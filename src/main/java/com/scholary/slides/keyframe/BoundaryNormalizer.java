package com.scholary.slides.keyframe;

import com.scholary.slides.detection.TimeInterval;
import com.scholary.slides.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw detector intervals into the initial candidate sequence.
 *
 * <p>Each interval is reduced to one representative timestamp, representatives outside the window
 * are discarded, and the rest is sorted with duplicates collapsed. Detectors only promise "roughly
 * sorted" output and may report overlapping intervals, so nothing about the input order is
 * trusted.
 *
 * <p>An empty detector result yields an empty sequence; the fallback decision belongs to the
 * {@link TemporalFilter}.
 */
@Component
public class BoundaryNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(BoundaryNormalizer.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /**
   * Normalize detector output.
   *
   * @param intervals detector intervals, in any order
   * @param window the time window to honour
   * @param policy how an interval is reduced to a timestamp
   * @return strictly increasing candidate timestamps
   */
  public List<Double> normalize(
      List<TimeInterval> intervals, TimeWindow window, RepresentativePolicy policy) {
    List<Double> representatives = new ArrayList<>(intervals.size());
    for (TimeInterval interval : intervals) {
      double representative = policy.representativeOf(interval);
      if (!window.contains(representative)) {
        LOGGER.debug(
            "Discarding {}s: outside window [{}-{}]", representative, window.start(), window.end());
        continue;
      }
      representatives.add(representative);
    }
    Collections.sort(representatives);

    List<Double> candidates = new ArrayList<>(representatives.size());
    for (double representative : representatives) {
      if (!candidates.isEmpty()
          && Timestamps.same(candidates.get(candidates.size() - 1), representative)) {
        continue;
      }
      candidates.add(representative);
    }

    structuredLogger.logCandidatesNormalized(intervals.size(), candidates.size(), policy.name());
    return candidates;
  }
}
