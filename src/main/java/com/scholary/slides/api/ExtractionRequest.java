package com.scholary.slides.api;

import com.scholary.slides.detection.DetectionMethod;
import com.scholary.slides.keyframe.RepresentativePolicy;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request for extracting slide keyframes from a local video.
 *
 * <p>Every tuning value is optional; unset values fall back to the configured {@code
 * keyframe.defaults}. Out-of-domain values are rejected with HTTP 400 before the job starts.
 *
 * @param videoPath local video file
 * @param outputDir directory receiving {@code slides/} (and {@code full/}) pages
 * @param crop slide region as {@code left,top,width,height} fractions, blank for the full frame
 * @param startTime window start as {@code HH:MM:SS} or seconds
 * @param endTime window end as {@code HH:MM:SS} or seconds
 * @param fullScreen also write uncropped pages at the same timestamps
 * @param maxRunSeconds deadline for the whole run
 */
public record ExtractionRequest(
    @NotBlank String videoPath,
    @NotBlank String outputDir,
    String crop,
    String startTime,
    String endTime,
    DetectionMethod method,
    RepresentativePolicy representativePolicy,
    Double sceneThreshold,
    Integer minSceneLength,
    Double staticThreshold,
    Double duplicateThreshold,
    Double minGapSeconds,
    Double maxGapSeconds,
    Double fillIntervalSeconds,
    Boolean fullScreen,
    @Positive Long maxRunSeconds) {

  public ExtractionRequest {
    if (fullScreen == null) {
      fullScreen = false;
    }
  }

  /** A request for a video with every other value defaulted. */
  public static ExtractionRequest of(String videoPath, String outputDir) {
    return new ExtractionRequest(
        videoPath, outputDir, null, null, null, null, null, null, null, null, null, null, null,
        null, null, null);
  }
}
