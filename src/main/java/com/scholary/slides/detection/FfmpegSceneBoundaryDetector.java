package com.scholary.slides.detection;

import com.scholary.slides.keyframe.CancellationToken;
import com.scholary.slides.media.FfmpegProperties;
import com.scholary.slides.media.VideoSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Content-aware scene detection with ffmpeg's {@code select} filter.
 *
 * <p>ffmpeg scores each frame against its predecessor (0 to 1) and {@code showinfo} prints the
 * frames whose score exceeds the threshold. The cut times are parsed from stderr.
 */
@Component
public class FfmpegSceneBoundaryDetector implements SceneBoundaryDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegSceneBoundaryDetector.class);

  // Example: [Parsed_showinfo_1 @ 0x...] n:   3 pts:  90090 pts_time:3.003 ...
  private static final Pattern PTS_TIME_PATTERN = Pattern.compile("pts_time:\\s*([0-9.]+)");

  private static final double MIN_SCENE_SCORE = 0.01;
  private static final double MAX_SCENE_SCORE = 1.0;

  private final FfmpegProperties properties;

  public FfmpegSceneBoundaryDetector(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public DetectionMethod method() {
    return DetectionMethod.SCENE_CONTENT;
  }

  @Override
  public List<TimeInterval> detect(
      VideoSource video,
      double sensitivity,
      int minSceneLengthFrames,
      CancellationToken cancellation)
      throws IOException {
    cancellation.throwIfCancellationRequested();
    double score = toSceneScore(sensitivity);
    String select = String.format(Locale.ROOT, "select='gt(scene,%.3f)',showinfo", score);

    List<String> command = new ArrayList<>();
    command.add(properties.ffmpegPath());
    command.add("-hide_banner");
    command.add("-i");
    command.add(video.path().toString());
    command.add("-vf");
    command.add(video.videoFilter(select).orElseThrow());
    command.add("-an");
    command.add("-f");
    command.add("null");
    command.add("-");

    LOGGER.info("Detecting scenes in {} (scene score > {})", video.path(), score);
    LOGGER.debug("Executing: {}", String.join(" ", command));

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
    Process process = pb.start();

    List<Double> cuts = readCutTimes(process, cancellation);

    try {
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        throw new IOException("ffmpeg scene detection exited with code " + exitCode);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Scene detection interrupted", e);
    }

    double minSceneSeconds = minSceneLengthFrames / video.frameRate();
    List<TimeInterval> intervals = buildIntervals(cuts, video.durationSeconds(), minSceneSeconds);
    LOGGER.info("Detected {} scene cuts, {} intervals", cuts.size(), intervals.size());
    return intervals;
  }

  /**
   * Map a detector sensitivity onto ffmpeg's scene score.
   *
   * <p>Sensitivities are on a 0 to 100 scale, so 12 means a score above 0.12.
   */
  static double toSceneScore(double sensitivity) {
    return Math.max(MIN_SCENE_SCORE, Math.min(MAX_SCENE_SCORE, sensitivity / 100.0));
  }

  /** Read cut times from a running ffmpeg; the process is killed if reading stops early. */
  static List<Double> readCutTimes(Process process, CancellationToken cancellation)
      throws IOException {
    try (Reader stderr = new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8)) {
      return parseCutTimes(new BufferedReader(stderr), cancellation);
    } catch (IOException | RuntimeException e) {
      process.destroyForcibly();
      throw e;
    }
  }

  static List<Double> parseCutTimes(BufferedReader reader, CancellationToken cancellation)
      throws IOException {
    List<Double> cuts = new ArrayList<>();
    String line;
    while ((line = reader.readLine()) != null) {
      cancellation.throwIfCancellationRequested();
      Matcher matcher = PTS_TIME_PATTERN.matcher(line);
      if (matcher.find()) {
        try {
          cuts.add(Double.parseDouble(matcher.group(1)));
        } catch (NumberFormatException e) {
          LOGGER.debug("Ignoring malformed pts_time in: {}", line);
        }
      }
    }
    return cuts;
  }

  /**
   * Turn cut times into consecutive intervals covering {@code [0, duration]}.
   *
   * <p>Cuts outside the video, or closer than {@code minSceneSeconds} to the previous boundary,
   * are ignored.
   */
  static List<TimeInterval> buildIntervals(
      List<Double> cuts, double durationSeconds, double minSceneSeconds) {
    if (durationSeconds <= 0) {
      return List.of();
    }
    List<Double> sorted = new ArrayList<>(cuts);
    sorted.sort(Double::compare);

    List<Double> boundaries = new ArrayList<>();
    boundaries.add(0.0);
    for (double cut : sorted) {
      double previous = boundaries.get(boundaries.size() - 1);
      if (cut <= 0 || cut >= durationSeconds || cut - previous < minSceneSeconds) {
        continue;
      }
      boundaries.add(cut);
    }

    List<TimeInterval> intervals = new ArrayList<>(boundaries.size());
    for (int i = 0; i < boundaries.size(); i++) {
      double end = i + 1 < boundaries.size() ? boundaries.get(i + 1) : durationSeconds;
      intervals.add(new TimeInterval(boundaries.get(i), end));
    }
    return intervals;
  }
}
