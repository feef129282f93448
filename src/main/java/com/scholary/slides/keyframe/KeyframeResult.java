package com.scholary.slides.keyframe;

import com.scholary.slides.frame.Frame;
import java.util.List;

/**
 * Outcome of one pipeline run.
 *
 * <p>Owns the keyframe frames; close it once the frames have been written out.
 *
 * @param keyframes consolidated keyframes
 * @param degradedDetection true when the run fell back to a single candidate
 * @param stageCounts candidate counts per stage
 */
public record KeyframeResult(
    ConsolidatedKeyframes keyframes, boolean degradedDetection, StageCounts stageCounts)
    implements AutoCloseable {

  public List<Double> timestamps() {
    return keyframes.retainedTimestamps();
  }

  public List<Frame> frames() {
    return keyframes.frames();
  }

  public int size() {
    return keyframes.size();
  }

  @Override
  public void close() {
    keyframes.close();
  }
}
