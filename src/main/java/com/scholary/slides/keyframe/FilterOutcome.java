package com.scholary.slides.keyframe;

import java.util.List;

/**
 * Result of the temporal filter.
 *
 * @param candidates surviving candidates, strictly increasing
 * @param degraded true when no candidate survived and the single fallback candidate was used
 */
public record FilterOutcome(List<Double> candidates, boolean degraded) {

  public FilterOutcome {
    candidates = List.copyOf(candidates);
  }

  public int size() {
    return candidates.size();
  }
}
