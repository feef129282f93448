package com.scholary.slides.frame;

/**
 * Pure scoring functions over decoded frames.
 *
 * <p>Implementations never throw for missing or undecodable frames. They return scores that make
 * such frames fail the validity checks instead: zero sharpness (static) and zero dissimilarity
 * (indistinguishable from the reference).
 */
public interface FrameMetric {

  /**
   * Structural detail of a single frame.
   *
   * @param frame the frame, may be null
   * @return a non-negative score, higher means more detail
   */
  double sharpness(Frame frame);

  /**
   * Visual distance between two frames.
   *
   * @param first the reference frame, may be null
   * @param second the compared frame, may be null
   * @return a non-negative score, 0 for pixel-identical frames
   */
  double dissimilarity(Frame first, Frame second);
}
