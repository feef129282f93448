package com.scholary.slides.service;

import com.scholary.slides.detection.DetectionMethod;
import com.scholary.slides.keyframe.FilterParameters;
import com.scholary.slides.keyframe.RepresentativePolicy;
import com.scholary.slides.keyframe.TimeWindow;
import com.scholary.slides.media.CropRegion;
import java.nio.file.Path;

/**
 * A fully validated extraction: request values resolved over the configured defaults.
 *
 * <p>Building a plan touches no video, so every parameter error surfaces before any work starts.
 */
public record ExtractionPlan(
    Path video,
    Path outputDirectory,
    CropRegion crop,
    TimeWindow window,
    FilterParameters parameters,
    DetectionMethod method,
    RepresentativePolicy policy,
    boolean fullScreen) {

  public ExtractionPlan withParameters(FilterParameters newParameters) {
    return new ExtractionPlan(
        video, outputDirectory, crop, window, newParameters, method, policy, fullScreen);
  }

  public ExtractionPlan withOutputDirectory(Path newOutputDirectory) {
    return new ExtractionPlan(
        video, newOutputDirectory, crop, window, parameters, method, policy, fullScreen);
  }
}
