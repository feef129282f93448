package com.scholary.slides.media;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Reads duration and frame rate of a local video with ffprobe. */
@Component
public class VideoProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(VideoProbe.class);

  static final double DEFAULT_FRAME_RATE = 25.0;

  private final FfmpegProperties properties;

  public VideoProbe(FfmpegProperties properties) {
    this.properties = properties;
  }

  /**
   * Probe a video.
   *
   * @param video local video file
   * @param crop region to sample from it
   * @return the probed source
   * @throws IOException if the file is missing or ffprobe fails
   */
  public VideoSource open(Path video, CropRegion crop) throws IOException {
    if (!Files.isRegularFile(video)) {
      throw new IOException("Video file not found: " + video);
    }
    String duration = probe(video, "-show_entries", "format=duration");
    String frameRate =
        probe(video, "-select_streams", "v:0", "-show_entries", "stream=r_frame_rate");

    double durationSeconds;
    try {
      durationSeconds = Double.parseDouble(duration);
    } catch (NumberFormatException e) {
      throw new IOException("Failed to parse duration from ffprobe output: " + duration, e);
    }

    VideoSource source = new VideoSource(video, crop, durationSeconds, parseFrameRate(frameRate));
    LOGGER.info(
        "Probed {}: duration={}s, fps={}, crop={}",
        video,
        source.durationSeconds(),
        source.frameRate(),
        source.crop());
    return source;
  }

  /**
   * Parse ffprobe's {@code r_frame_rate}, a fraction such as {@code 30000/1001}.
   *
   * <p>Falls back to 25 fps when the value is missing or degenerate.
   */
  static double parseFrameRate(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT_FRAME_RATE;
    }
    String[] parts = value.trim().split("/");
    try {
      double rate =
          parts.length == 2
              ? Double.parseDouble(parts[0]) / Double.parseDouble(parts[1])
              : Double.parseDouble(parts[0]);
      if (!Double.isFinite(rate) || rate <= 0) {
        return DEFAULT_FRAME_RATE;
      }
      return rate;
    } catch (NumberFormatException e) {
      LOGGER.debug("Unparsable frame rate '{}', assuming {} fps", value, DEFAULT_FRAME_RATE);
      return DEFAULT_FRAME_RATE;
    }
  }

  private String probe(Path video, String... entries) throws IOException {
    String[] command = new String[entries.length + 6];
    command[0] = properties.ffprobePath();
    command[1] = "-v";
    command[2] = "error";
    System.arraycopy(entries, 0, command, 3, entries.length);
    command[entries.length + 3] = "-of";
    command[entries.length + 4] = "default=noprint_wrappers=1:nokey=1";
    command[entries.length + 5] = video.toString();

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);

    LOGGER.debug("Executing: {}", String.join(" ", command));
    Process process = pb.start();
    try {
      String output =
          new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
      if (!process.waitFor(properties.probeTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new IOException("ffprobe timed out after " + properties.probeTimeout());
      }
      if (process.exitValue() != 0) {
        LOGGER.error("ffprobe failed: video={}, output={}", video, output);
        throw new IOException(
            "ffprobe failed with exit code: " + process.exitValue() + ", output: " + output);
      }
      // first line only; multi-stream files report one value per stream
      int newline = output.indexOf('\n');
      return newline >= 0 ? output.substring(0, newline).trim() : output;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("ffprobe interrupted", e);
    }
  }
}
