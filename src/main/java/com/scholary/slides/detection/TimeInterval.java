package com.scholary.slides.detection;

/**
 * A content-change interval reported by a scene-boundary detector, in seconds.
 *
 * <p>Immutable once returned by the detector.
 */
public record TimeInterval(double start, double end) {

  public TimeInterval {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double midpoint() {
    return (start + end) / 2.0;
  }
}
