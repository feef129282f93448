package com.scholary.slides.keyframe;

/** Non-fatal conditions absorbed by the pipeline and reported through the progress channel. */
public enum PipelineDiagnostic {
  /**
   * Detection produced no usable candidate and the run fell back to a single candidate at the
   * window start.
   */
  DEGRADED_DETECTION,

  /** A frame could not be sampled or decoded; the candidate is treated as static. */
  UNREADABLE_FRAME
}
