package com.scholary.slides.keyframe;

/**
 * Immutable tuning for one keyframe selection run.
 *
 * <p>Values are validated on construction; out-of-domain values raise {@link
 * InvalidParametersException} before any video work happens.
 *
 * @param boundarySensitivity detector threshold, lower yields more candidates
 * @param minBoundaryGapFrames minimum scene length in frames inside the detector
 * @param staticThreshold sharpness below which a frame counts as noise, 0 disables
 * @param duplicateThreshold dissimilarity below which a frame repeats its predecessor, 0 disables
 * @param minTimeGap minimum seconds between two kept candidates
 * @param maxTimeGap gap in seconds beyond which gap filling kicks in, 0 disables
 * @param fillInterval seconds between synthetic fill points, 0 disables
 */
public record FilterParameters(
    double boundarySensitivity,
    int minBoundaryGapFrames,
    double staticThreshold,
    double duplicateThreshold,
    double minTimeGap,
    double maxTimeGap,
    double fillInterval) {

  public FilterParameters {
    if (!Double.isFinite(boundarySensitivity) || boundarySensitivity <= 0) {
      throw new InvalidParametersException(
          "Boundary sensitivity must be positive: " + boundarySensitivity);
    }
    if (minBoundaryGapFrames < 1) {
      throw new InvalidParametersException(
          "Minimum scene length must be at least one frame: " + minBoundaryGapFrames);
    }
    requireNonNegative("Static threshold", staticThreshold);
    requireNonNegative("Duplicate threshold", duplicateThreshold);
    requireNonNegative("Minimum time gap", minTimeGap);
    requireNonNegative("Maximum time gap", maxTimeGap);
    requireNonNegative("Fill interval", fillInterval);
    if (fillInterval > 0 && fillInterval < Timestamps.EPSILON_SECONDS) {
      throw new InvalidParametersException(
          "Fill interval must be 0 or at least "
              + Timestamps.EPSILON_SECONDS
              + "s: "
              + fillInterval);
    }
  }

  /** Tuning that works for typical lecture recordings. */
  public static FilterParameters defaults() {
    return new FilterParameters(12.0, 5, 2.0, 1.5, 0.5, 45.0, 15.0);
  }

  public boolean staticFilteringEnabled() {
    return staticThreshold > 0;
  }

  public boolean duplicateFilteringEnabled() {
    return duplicateThreshold > 0;
  }

  public boolean gapFillingEnabled() {
    return maxTimeGap > 0 && fillInterval > 0;
  }

  private static void requireNonNegative(String name, double value) {
    if (!Double.isFinite(value) || value < 0) {
      throw new InvalidParametersException(name + " must be a non-negative number: " + value);
    }
  }
}
