package com.scholary.slides.media;

import com.scholary.slides.keyframe.InvalidParametersException;
import java.util.Locale;

/**
 * Rectangular region of the video frame holding the slide, in fractions of the frame size.
 *
 * <p>Recordings often show the slide next to a speaker camera. Cropping before detection keeps
 * speaker motion from registering as slide changes.
 *
 * @param left left edge, 0 to 1
 * @param top top edge, 0 to 1
 * @param width region width, above 0 and at most {@code 1 - left}
 * @param height region height, above 0 and at most {@code 1 - top}
 */
public record CropRegion(double left, double top, double width, double height) {

  public static final CropRegion FULL = new CropRegion(0, 0, 1, 1);

  private static final double TOLERANCE = 1e-9;

  public CropRegion {
    if (!inUnit(left) || !inUnit(top)) {
      throw new InvalidParametersException(
          String.format("Crop origin must lie within the frame: left=%s, top=%s", left, top));
    }
    if (!(width > 0) || !(height > 0)) {
      throw new InvalidParametersException(
          String.format("Crop size must be positive: width=%s, height=%s", width, height));
    }
    if (left + width > 1 + TOLERANCE || top + height > 1 + TOLERANCE) {
      throw new InvalidParametersException(
          String.format(
              "Crop region exceeds the frame: %s,%s,%s,%s", left, top, width, height));
    }
  }

  /**
   * Parse {@code "left,top,width,height"}.
   *
   * @param value the crop string, null or blank for the full frame
   * @return the region
   */
  public static CropRegion parse(String value) {
    if (value == null || value.isBlank()) {
      return FULL;
    }
    String[] parts = value.trim().split("\\s*,\\s*");
    if (parts.length != 4) {
      throw new InvalidParametersException("Expected crop as left,top,width,height: " + value);
    }
    try {
      return new CropRegion(
          Double.parseDouble(parts[0]),
          Double.parseDouble(parts[1]),
          Double.parseDouble(parts[2]),
          Double.parseDouble(parts[3]));
    } catch (NumberFormatException e) {
      throw new InvalidParametersException("Invalid crop value: " + value, e);
    }
  }

  public boolean isFull() {
    return left == 0 && top == 0 && width == 1 && height == 1;
  }

  /** The ffmpeg {@code crop} filter expression for this region. */
  public String toFfmpegFilter() {
    return String.format(
        Locale.ROOT, "crop=iw*%.6f:ih*%.6f:iw*%.6f:ih*%.6f", width, height, left, top);
  }

  private static boolean inUnit(double value) {
    return value >= 0 && value < 1;
  }
}
