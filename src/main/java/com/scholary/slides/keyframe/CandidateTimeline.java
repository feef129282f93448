package com.scholary.slides.keyframe;

import java.util.List;

/**
 * Candidate timestamps of a dry run, before any frame is sampled.
 *
 * <p>Frame-based filters need decoded frames and are skipped, so these are upper bounds of what a
 * full run would keep.
 *
 * @param normalized candidates after normalization
 * @param coalesced candidates after minimum-gap coalescing
 * @param gapFilled candidates after gap filling
 */
public record CandidateTimeline(
    List<Double> normalized, List<Double> coalesced, List<Double> gapFilled) {

  public CandidateTimeline {
    normalized = List.copyOf(normalized);
    coalesced = List.copyOf(coalesced);
    gapFilled = List.copyOf(gapFilled);
  }
}
