package com.scholary.slides.frame;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

/**
 * OpenCV implementation of {@link FrameMetric}.
 *
 * <ul>
 *   <li>Sharpness is the variance of the Laplacian over the grayscale image. Solid colour frames
 *       (black screens, codec artefacts) score 0.
 *   <li>Dissimilarity is the mean absolute grayscale difference per pixel, on the 0-255 scale.
 * </ul>
 *
 * <p>Frames of different sizes are compared at the smaller of the two resolutions: the larger one
 * is downscaled with area interpolation first.
 */
@Component
public class OpenCvFrameMetric implements FrameMetric {

  public OpenCvFrameMetric() {
    OpenCvLoader.ensureLoaded();
  }

  @Override
  public double sharpness(Frame frame) {
    if (frame == null || !frame.isReadable()) {
      return 0.0;
    }
    Mat gray = toGray(frame.image());
    Mat laplacian = new Mat();
    MatOfDouble mean = new MatOfDouble();
    MatOfDouble stddev = new MatOfDouble();
    try {
      Imgproc.Laplacian(gray, laplacian, CvType.CV_64F);
      Core.meanStdDev(laplacian, mean, stddev);
      double deviation = stddev.get(0, 0)[0];
      return deviation * deviation;
    } finally {
      gray.release();
      laplacian.release();
      mean.release();
      stddev.release();
    }
  }

  @Override
  public double dissimilarity(Frame first, Frame second) {
    if (first == null || second == null || !first.isReadable() || !second.isReadable()) {
      return 0.0;
    }
    Mat grayFirst = toGray(first.image());
    Mat graySecond = toGray(second.image());
    Mat diff = new Mat();
    try {
      if (!grayFirst.size().equals(graySecond.size())) {
        Size reference =
            grayFirst.size().area() <= graySecond.size().area()
                ? grayFirst.size()
                : graySecond.size();
        resizeInPlace(grayFirst, reference);
        resizeInPlace(graySecond, reference);
      }
      Core.absdiff(grayFirst, graySecond, diff);
      return Core.mean(diff).val[0];
    } finally {
      grayFirst.release();
      graySecond.release();
      diff.release();
    }
  }

  private static Mat toGray(Mat image) {
    Mat gray = new Mat();
    switch (image.channels()) {
      case 3 -> Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
      case 4 -> Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGRA2GRAY);
      default -> image.copyTo(gray);
    }
    return gray;
  }

  private static void resizeInPlace(Mat image, Size reference) {
    if (image.size().equals(reference)) {
      return;
    }
    Mat resized = new Mat();
    Imgproc.resize(image, resized, reference, 0, 0, Imgproc.INTER_AREA);
    resized.copyTo(image);
    resized.release();
  }
}
