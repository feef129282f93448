package com.scholary.slides.keyframe;

import com.scholary.slides.frame.Frame;
import java.util.List;

/**
 * The definitive, read-only keyframe list.
 *
 * <p>{@code retainedTimestamps} are the candidate timestamps at the positions kept by
 * consolidation. A second extraction pass over a differently cropped view of the same video samples
 * exactly these instants. Closing releases every frame.
 *
 * @param keyframes ordered keyframes
 * @param retainedTimestamps the timestamps kept, parallel to {@code keyframes}
 */
public record ConsolidatedKeyframes(List<Keyframe> keyframes, List<Double> retainedTimestamps)
    implements AutoCloseable {

  public ConsolidatedKeyframes {
    keyframes = List.copyOf(keyframes);
    retainedTimestamps = List.copyOf(retainedTimestamps);
  }

  public int size() {
    return keyframes.size();
  }

  public List<Frame> frames() {
    return keyframes.stream().map(Keyframe::frame).toList();
  }

  @Override
  public void close() {
    keyframes.forEach(keyframe -> Frame.release(keyframe.frame()));
  }
}
