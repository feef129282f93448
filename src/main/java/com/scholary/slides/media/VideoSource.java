package com.scholary.slides.media;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A probed local video together with the view the pipeline samples from it.
 *
 * @param path local video file
 * @param crop region of the frame to use
 * @param durationSeconds container duration
 * @param frameRate average frame rate
 */
public record VideoSource(Path path, CropRegion crop, double durationSeconds, double frameRate) {

  public VideoSource {
    if (crop == null) {
      crop = CropRegion.FULL;
    }
  }

  /** The same video without cropping. */
  public VideoSource uncropped() {
    return new VideoSource(path, CropRegion.FULL, durationSeconds, frameRate);
  }

  public boolean isCropped() {
    return !crop.isFull();
  }

  /**
   * Build the {@code -vf} filter chain, crop first.
   *
   * @param extra filters appended after the crop
   * @return the chain, or empty when there is nothing to apply
   */
  public Optional<String> videoFilter(String... extra) {
    List<String> filters = new ArrayList<>();
    if (isCropped()) {
      filters.add(crop.toFfmpegFilter());
    }
    filters.addAll(List.of(extra));
    return filters.isEmpty() ? Optional.empty() : Optional.of(String.join(",", filters));
  }
}
