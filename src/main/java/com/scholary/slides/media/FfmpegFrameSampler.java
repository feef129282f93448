package com.scholary.slides.media;

import com.scholary.slides.frame.Frame;
import com.scholary.slides.frame.OpenCvLoader;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Samples frames by running ffmpeg once per timestamp and decoding its PNG output with OpenCV.
 *
 * <p>Input seeking ({@code -ss} before {@code -i}) keeps each sample cheap on long recordings.
 */
@Component
public class FfmpegFrameSampler implements FrameSampler {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegFrameSampler.class);

  private final FfmpegProperties properties;

  public FfmpegFrameSampler(FfmpegProperties properties) {
    this.properties = properties;
    OpenCvLoader.ensureLoaded();
  }

  @Override
  public Optional<Frame> sample(VideoSource video, double timestampSeconds) {
    try {
      byte[] png = decodeToPng(video, timestampSeconds);
      if (png.length == 0) {
        LOGGER.debug("ffmpeg returned no frame at {}s", timestampSeconds);
        return Optional.empty();
      }
      MatOfByte encoded = new MatOfByte(png);
      Mat image = Imgcodecs.imdecode(encoded, Imgcodecs.IMREAD_COLOR);
      encoded.release();
      if (image.empty()) {
        image.release();
        return Optional.empty();
      }
      return Optional.of(new Frame(timestampSeconds, image));
    } catch (IOException e) {
      LOGGER.warn(
          "Failed to sample frame at {}s from {}: {}",
          timestampSeconds,
          video.path(),
          e.getMessage());
      return Optional.empty();
    }
  }

  List<String> buildCommand(VideoSource video, double timestampSeconds) {
    List<String> command = new ArrayList<>();
    command.add(properties.ffmpegPath());
    command.add("-hide_banner");
    command.add("-loglevel");
    command.add("error");
    command.add("-ss");
    command.add(String.format(Locale.ROOT, "%.3f", timestampSeconds));
    command.add("-i");
    command.add(video.path().toString());
    video
        .videoFilter()
        .ifPresent(
            filter -> {
              command.add("-vf");
              command.add(filter);
            });
    command.add("-frames:v");
    command.add("1");
    command.add("-f");
    command.add("image2pipe");
    command.add("-vcodec");
    command.add("png");
    command.add("-");
    return command;
  }

  private byte[] decodeToPng(VideoSource video, double timestampSeconds) throws IOException {
    ProcessBuilder pb = new ProcessBuilder(buildCommand(video, timestampSeconds));
    pb.redirectError(ProcessBuilder.Redirect.DISCARD);

    Process process = pb.start();
    CompletableFuture<byte[]> output =
        CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
    try {
      if (!process.waitFor(properties.sampleTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new IOException(
            String.format(
                "ffmpeg timed out sampling %ss after %s",
                timestampSeconds, properties.sampleTimeout()));
      }
      byte[] bytes = output.get(properties.sampleTimeout().toMillis(), TimeUnit.MILLISECONDS);
      if (process.exitValue() != 0) {
        throw new IOException("ffmpeg frame extraction exited with code " + process.exitValue());
      }
      return bytes;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new IOException("Frame sampling interrupted", e);
    } catch (ExecutionException | TimeoutException e) {
      process.destroyForcibly();
      throw new IOException("Failed to read ffmpeg output", e);
    }
  }

  private static byte[] readFully(InputStream stream) {
    try (stream) {
      return stream.readAllBytes();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
