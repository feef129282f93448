package com.scholary.slides.frame;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/** Small synthetic frames for tests. */
public final class TestFrames {

  static {
    OpenCvLoader.ensureLoaded();
  }

  private TestFrames() {}

  public static Frame gray(double timestamp, int width, int height, int value) {
    return new Frame(timestamp, new Mat(height, width, CvType.CV_8UC1, new Scalar(value)));
  }

  public static Frame bgr(double timestamp, int width, int height, int b, int g, int r) {
    return new Frame(timestamp, new Mat(height, width, CvType.CV_8UC3, new Scalar(b, g, r)));
  }

  public static Frame checkerboard(double timestamp, int width, int height, int cell) {
    Mat image = new Mat(height, width, CvType.CV_8UC1, new Scalar(0));
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        if ((x / cell + y / cell) % 2 == 0) {
          image.put(y, x, 255);
        }
      }
    }
    return new Frame(timestamp, image);
  }

  /** A gray frame where the first {@code changed} pixels are one level brighter. */
  public static Frame grayWithShift(
      double timestamp, int width, int height, int value, int changed) {
    Mat image = new Mat(height, width, CvType.CV_8UC1, new Scalar(value));
    for (int i = 0; i < changed; i++) {
      image.put(i / width, i % width, value + 1);
    }
    return new Frame(timestamp, image);
  }

  public static Frame empty(double timestamp) {
    return new Frame(timestamp, new Mat());
  }
}
