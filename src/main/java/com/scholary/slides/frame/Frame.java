package com.scholary.slides.frame;

import org.opencv.core.Mat;

/**
 * A decoded raster image sampled from the video at a timestamp.
 *
 * <p>A frame owns native memory. Whoever sampled it owns it and must {@link #close()} it; frames
 * are never handed from one pipeline stage to another.
 */
public final class Frame implements AutoCloseable {

  private final double timestamp;
  private final Mat image;

  public Frame(double timestamp, Mat image) {
    this.timestamp = timestamp;
    this.image = image;
  }

  public double timestamp() {
    return timestamp;
  }

  public Mat image() {
    return image;
  }

  /** A frame is readable when it holds decoded pixels. */
  public boolean isReadable() {
    return image != null && !image.empty();
  }

  public int width() {
    return image != null ? image.cols() : 0;
  }

  public int height() {
    return image != null ? image.rows() : 0;
  }

  @Override
  public void close() {
    if (image != null) {
      image.release();
    }
  }

  /** Close a frame that may be null. */
  public static void release(Frame frame) {
    if (frame != null) {
      frame.close();
    }
  }

  @Override
  public String toString() {
    return String.format("Frame[t=%.3fs, %dx%d]", timestamp, width(), height());
  }
}
