package com.scholary.slides.keyframe;

/**
 * Comparison helpers for candidate timestamps.
 *
 * <p>Two timestamps closer than {@link #EPSILON_SECONDS} denote the same instant. Synthetic fill
 * points and detector midpoints are computed in floating point, so exact equality is not a usable
 * identity for them.
 */
public final class Timestamps {

  /** One millisecond. */
  public static final double EPSILON_SECONDS = 0.001;

  private Timestamps() {}

  public static boolean same(double a, double b) {
    return Math.abs(a - b) < EPSILON_SECONDS;
  }
}
