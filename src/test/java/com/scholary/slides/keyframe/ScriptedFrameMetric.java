package com.scholary.slides.keyframe;

import com.scholary.slides.frame.Frame;
import com.scholary.slides.frame.FrameMetric;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Frame metric with scores looked up by frame timestamp.
 *
 * <p>Dissimilarity is keyed by the timestamp of the second (newer) frame, and every comparison is
 * recorded as a {@code [reference, candidate]} pair.
 */
class ScriptedFrameMetric implements FrameMetric {

  private final Map<Double, Double> sharpness = new HashMap<>();
  private final Map<Double, Double> dissimilarity = new HashMap<>();
  private final List<double[]> comparisons = new ArrayList<>();

  ScriptedFrameMetric sharpness(double timestamp, double score) {
    sharpness.put(timestamp, score);
    return this;
  }

  ScriptedFrameMetric dissimilarity(double timestamp, double score) {
    dissimilarity.put(timestamp, score);
    return this;
  }

  List<double[]> comparisons() {
    return comparisons;
  }

  @Override
  public double sharpness(Frame frame) {
    if (frame == null || !frame.isReadable()) {
      return 0.0;
    }
    return sharpness.getOrDefault(frame.timestamp(), 100.0);
  }

  @Override
  public double dissimilarity(Frame first, Frame second) {
    if (first == null || second == null || !first.isReadable() || !second.isReadable()) {
      return 0.0;
    }
    comparisons.add(new double[] {first.timestamp(), second.timestamp()});
    return dissimilarity.getOrDefault(second.timestamp(), 100.0);
  }
}
