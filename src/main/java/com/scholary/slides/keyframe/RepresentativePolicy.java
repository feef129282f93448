package com.scholary.slides.keyframe;

import com.scholary.slides.detection.TimeInterval;

/** How a detected content-change interval is reduced to a single candidate timestamp. */
public enum RepresentativePolicy {
  /**
   * The middle of the interval.
   *
   * <p>Suits detectors that already isolate tight scene boundaries.
   */
  MIDPOINT {
    @Override
    public double representativeOf(TimeInterval interval) {
      return interval.midpoint();
    }
  },

  /**
   * The start of the interval.
   *
   * <p>Suits static slide decks without a narrator in frame: content settles right after a cut, and
   * the start avoids landing on a half-rendered transition later in the interval.
   */
  START {
    @Override
    public double representativeOf(TimeInterval interval) {
      return interval.start();
    }
  };

  public abstract double representativeOf(TimeInterval interval);
}
