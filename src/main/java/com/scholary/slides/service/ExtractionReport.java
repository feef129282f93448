package com.scholary.slides.service;

import com.scholary.slides.keyframe.StageCounts;
import java.util.List;

/**
 * Result of a completed extraction.
 *
 * @param timestamps keyframe timestamps in display order
 * @param slidePages written slide pages, parallel to {@code timestamps}
 * @param fullScreenPages written uncropped pages; empty unless requested with a crop
 * @param degradedDetection true when detection found nothing usable and a single fallback frame
 *     was used
 * @param stageCounts candidate counts per pipeline stage
 */
public record ExtractionReport(
    List<Double> timestamps,
    List<String> slidePages,
    List<String> fullScreenPages,
    boolean degradedDetection,
    StageCounts stageCounts) {

  public ExtractionReport {
    timestamps = List.copyOf(timestamps);
    slidePages = List.copyOf(slidePages);
    fullScreenPages = List.copyOf(fullScreenPages);
  }

  public int keyframeCount() {
    return timestamps.size();
  }
}
