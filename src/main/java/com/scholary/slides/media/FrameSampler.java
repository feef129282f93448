package com.scholary.slides.media;

import com.scholary.slides.frame.Frame;
import com.scholary.slides.keyframe.FrameSource;
import java.util.Optional;

/** Decodes single frames from a video. */
public interface FrameSampler {

  /**
   * Decode the frame shown at a timestamp, with the source's crop applied.
   *
   * @return the frame, or empty when decoding failed
   */
  Optional<Frame> sample(VideoSource video, double timestampSeconds);

  /** Bind this sampler to one video. */
  default FrameSource sourceFor(VideoSource video) {
    return timestamp -> sample(video, timestamp);
  }
}
