package com.scholary.slides.keyframe;

import com.scholary.slides.frame.Frame;
import com.scholary.slides.frame.TestFrames;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** In-memory frame source that hands out small gray frames and remembers them. */
class FakeFrameSource implements FrameSource {

  private final Set<Double> unreadable = new HashSet<>();
  private final Set<Double> failing = new HashSet<>();
  private final List<Double> requests = new ArrayList<>();
  private final List<Frame> issued = new ArrayList<>();
  private long peakOpenFrames;

  FakeFrameSource unreadableAt(double... timestamps) {
    for (double timestamp : timestamps) {
      unreadable.add(timestamp);
    }
    return this;
  }

  FakeFrameSource failingAt(double... timestamps) {
    for (double timestamp : timestamps) {
      failing.add(timestamp);
    }
    return this;
  }

  @Override
  public Optional<Frame> sampleAt(double timestampSeconds) {
    requests.add(timestampSeconds);
    if (failing.contains(timestampSeconds)) {
      throw new IllegalStateException("decoder failure at " + timestampSeconds);
    }
    if (unreadable.contains(timestampSeconds)) {
      return Optional.empty();
    }
    Frame frame = TestFrames.gray(timestampSeconds, 4, 4, 128);
    issued.add(frame);
    peakOpenFrames = Math.max(peakOpenFrames, openFrames());
    return Optional.of(frame);
  }

  List<Double> requests() {
    return requests;
  }

  /** Highest number of frames open at once, measured right after each sample. */
  long peakOpenFrames() {
    return peakOpenFrames;
  }

  /** Frames handed out and not yet released. */
  long openFrames() {
    return issued.stream().filter(Frame::isReadable).count();
  }
}
