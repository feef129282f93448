package com.scholary.slides.keyframe;

/**
 * Everything a pipeline run needs besides its inputs.
 *
 * @param parameters filter tuning
 * @param window time window to search, {@link TimeWindow#UNBOUNDED} for the whole video
 * @param policy how detector intervals become candidates
 * @param videoDurationSeconds known video duration, or null when unknown
 */
public record KeyframeContext(
    FilterParameters parameters,
    TimeWindow window,
    RepresentativePolicy policy,
    Double videoDurationSeconds) {

  public KeyframeContext {
    if (parameters == null) {
      throw new InvalidParametersException("Filter parameters are required");
    }
    if (window == null) {
      window = TimeWindow.UNBOUNDED;
    }
    if (policy == null) {
      policy = RepresentativePolicy.MIDPOINT;
    }
  }
}
