package com.scholary.slides.service;

import com.scholary.slides.keyframe.FilterParameters;
import java.util.List;

/**
 * A named parameter set for the sweep.
 *
 * <p>The defaults span from very sensitive detection without frame filters to conservative
 * detection without gap filling, which brackets most lecture recordings.
 */
public record SweepPreset(String name, FilterParameters parameters) {

  public static List<SweepPreset> defaults() {
    return List.of(
        preset("01_default", 12, 5, 2.0, 1.5, 0.5, 45, 15),
        preset("02_sensitive", 8, 3, 0, 0, 0.5, 45, 15),
        preset("03_medium", 10, 5, 0, 0, 0.5, 45, 15),
        preset("04_low_filter", 12, 5, 0, 0, 0.5, 45, 15),
        preset("05_conservative", 18, 8, 5, 3, 1.0, 0, 15),
        preset("06_very_sensitive", 6, 3, 0, 0, 0.3, 45, 15),
        preset("07_fill_aggressive", 10, 5, 0, 0, 0.5, 30, 10),
        preset("08_no_fill", 10, 5, 0, 0, 0.5, 0, 15));
  }

  private static SweepPreset preset(
      String name,
      double threshold,
      int minSceneLength,
      double staticThreshold,
      double duplicateThreshold,
      double minGap,
      double maxGap,
      double fillInterval) {
    return new SweepPreset(
        name,
        new FilterParameters(
            threshold,
            minSceneLength,
            staticThreshold,
            duplicateThreshold,
            minGap,
            maxGap,
            fillInterval));
  }
}
