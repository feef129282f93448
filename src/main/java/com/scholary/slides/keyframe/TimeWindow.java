package com.scholary.slides.keyframe;

/**
 * Optional time window restricting which part of the video is searched for slides.
 *
 * <p>Either bound may be open: an unset start is 0, an unset end is positive infinity. Bounds are
 * inclusive.
 */
public record TimeWindow(double start, double end) {

  public static final TimeWindow UNBOUNDED = new TimeWindow(0.0, Double.POSITIVE_INFINITY);

  public TimeWindow {
    if (Double.isNaN(start) || Double.isNaN(end)) {
      throw new InvalidParametersException("Time window bounds must be numbers");
    }
    if (start < 0) {
      throw new InvalidParametersException("Time window start cannot be negative: " + start);
    }
    if (end < start) {
      throw new InvalidParametersException(
          String.format("Time window end (%ss) must be >= start (%ss)", end, start));
    }
  }

  /**
   * Build a window from optional bounds.
   *
   * @param start start in seconds, or null for the beginning of the video
   * @param end end in seconds, or null for the end of the video
   * @return the window
   */
  public static TimeWindow of(Double start, Double end) {
    return new TimeWindow(
        start != null ? start : 0.0, end != null ? end : Double.POSITIVE_INFINITY);
  }

  /**
   * Parse a window from clock strings such as {@code 00:12:30}.
   *
   * <p>Blank or null strings leave that side open. Plain second values ({@code "750.5"}) are
   * accepted as well.
   */
  public static TimeWindow parse(String start, String end) {
    return of(parseClock(start), parseClock(end));
  }

  static Double parseClock(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String trimmed = value.trim();
    String[] parts = trimmed.split(":");
    try {
      if (parts.length == 1) {
        return Double.parseDouble(parts[0]);
      }
      if (parts.length == 3) {
        int hours = Integer.parseInt(parts[0]);
        int minutes = Integer.parseInt(parts[1]);
        double seconds = Double.parseDouble(parts[2]);
        if (hours < 0 || minutes < 0 || minutes >= 60 || seconds < 0 || seconds >= 60) {
          throw new InvalidParametersException("Clock value out of range: " + trimmed);
        }
        return hours * 3600.0 + minutes * 60.0 + seconds;
      }
    } catch (NumberFormatException e) {
      throw new InvalidParametersException("Invalid clock value: " + trimmed, e);
    }
    throw new InvalidParametersException("Expected HH:MM:SS or seconds, got: " + trimmed);
  }

  public boolean contains(double time) {
    return time >= start && time <= end;
  }
}
