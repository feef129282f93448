package com.scholary.slides.service;

import com.scholary.slides.keyframe.FilterParameters;

/**
 * Result of one sweep run.
 *
 * @param preset preset name
 * @param parameters the tuning used
 * @param keyframeCount keyframes written, -1 when the run failed
 * @param degradedDetection true when the run fell back to a single frame
 * @param outputDirectory where the pages of this run were written
 * @param error failure message, null on success
 */
public record SweepOutcome(
    String preset,
    FilterParameters parameters,
    int keyframeCount,
    boolean degradedDetection,
    String outputDirectory,
    String error) {

  static SweepOutcome success(SweepPreset preset, String outputDirectory, ExtractionReport report) {
    return new SweepOutcome(
        preset.name(),
        preset.parameters(),
        report.keyframeCount(),
        report.degradedDetection(),
        outputDirectory,
        null);
  }

  static SweepOutcome failure(SweepPreset preset, String outputDirectory, String error) {
    return new SweepOutcome(
        preset.name(), preset.parameters(), -1, false, outputDirectory, error);
  }

  public boolean succeeded() {
    return error == null;
  }
}
