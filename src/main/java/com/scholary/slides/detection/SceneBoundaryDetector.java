package com.scholary.slides.detection;

import com.scholary.slides.keyframe.CancellationToken;
import com.scholary.slides.media.VideoSource;
import java.io.IOException;
import java.util.List;

/**
 * Finds content-change intervals in a video.
 *
 * <p>Output is expected to be roughly sorted; the pipeline re-sorts it anyway.
 */
public interface SceneBoundaryDetector {

  /**
   * Detect content-change intervals.
   *
   * @param video the probed video, with its crop
   * @param sensitivity detector threshold, lower yields more intervals
   * @param minSceneLengthFrames minimum length of an interval in frames
   * @param cancellation polled between detector steps
   * @return the intervals covering the video
   * @throws IOException if the underlying tool fails
   */
  List<TimeInterval> detect(
      VideoSource video,
      double sensitivity,
      int minSceneLengthFrames,
      CancellationToken cancellation)
      throws IOException;

  DetectionMethod method();
}
