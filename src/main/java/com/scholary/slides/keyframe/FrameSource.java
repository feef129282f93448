package com.scholary.slides.keyframe;

import com.scholary.slides.frame.Frame;
import java.util.Optional;

/**
 * Frame sampling bound to one video for the duration of one run.
 *
 * <p>A source stands for a single decoder handle and is used sequentially. Every call returns a
 * freshly sampled frame owned by the caller, or empty when the frame could not be produced.
 */
@FunctionalInterface
public interface FrameSource {

  Optional<Frame> sampleAt(double timestampSeconds);
}
