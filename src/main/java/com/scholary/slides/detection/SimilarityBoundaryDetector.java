package com.scholary.slides.detection;

import com.scholary.slides.config.KeyframeProperties;
import com.scholary.slides.frame.Frame;
import com.scholary.slides.frame.FrameMetric;
import com.scholary.slides.keyframe.CancellationToken;
import com.scholary.slides.media.FrameSampler;
import com.scholary.slides.media.VideoSource;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Detection by walking the video at a fixed step and comparing consecutive frames.
 *
 * <p>Slower than {@link FfmpegSceneBoundaryDetector} but measures change with the same frame
 * metric the filters use, so the sensitivity reads as a dissimilarity threshold. Works well on
 * screen recordings where ffmpeg's scene score barely moves between slides.
 */
@Component
public class SimilarityBoundaryDetector implements SceneBoundaryDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(SimilarityBoundaryDetector.class);

  private final FrameSampler frameSampler;
  private final FrameMetric frameMetric;
  private final double stepSeconds;

  public SimilarityBoundaryDetector(
      FrameSampler frameSampler, FrameMetric frameMetric, KeyframeProperties properties) {
    this.frameSampler = frameSampler;
    this.frameMetric = frameMetric;
    this.stepSeconds = properties.evp().sampleStepSeconds();
  }

  @Override
  public DetectionMethod method() {
    return DetectionMethod.EVP;
  }

  @Override
  public List<TimeInterval> detect(
      VideoSource video,
      double sensitivity,
      int minSceneLengthFrames,
      CancellationToken cancellation) {
    double duration = video.durationSeconds();
    if (duration <= 0) {
      return List.of();
    }
    double minSceneSeconds = minSceneLengthFrames / video.frameRate();

    LOGGER.info(
        "Walking {} every {}s (dissimilarity >= {}, min scene {}s)",
        video.path(),
        stepSeconds,
        sensitivity,
        minSceneSeconds);

    List<Double> starts = new ArrayList<>();
    starts.add(0.0);
    Frame previous = null;
    int unreadable = 0;
    try {
      for (int k = 0; k * stepSeconds < duration; k++) {
        cancellation.throwIfCancellationRequested();
        double timestamp = k * stepSeconds;
        Frame current = frameSampler.sample(video, timestamp).orElse(null);
        if (current == null || !current.isReadable()) {
          Frame.release(current);
          unreadable++;
          continue;
        }
        if (previous != null) {
          double score = frameMetric.dissimilarity(previous, current);
          double lastStart = starts.get(starts.size() - 1);
          if (score >= sensitivity && timestamp - lastStart >= minSceneSeconds) {
            starts.add(timestamp);
          }
        }
        Frame.release(previous);
        previous = current;
      }
    } finally {
      Frame.release(previous);
    }

    List<TimeInterval> intervals = new ArrayList<>(starts.size());
    for (int i = 0; i < starts.size(); i++) {
      double end = i + 1 < starts.size() ? starts.get(i + 1) : duration;
      intervals.add(new TimeInterval(starts.get(i), end));
    }
    if (unreadable > 0) {
      LOGGER.warn("Skipped {} unreadable frames while walking {}", unreadable, video.path());
    }
    LOGGER.info("Similarity walk found {} intervals", intervals.size());
    return intervals;
  }
}
