package com.scholary.slides.service;

import com.scholary.slides.api.ExtractionRequest;
import com.scholary.slides.config.KeyframeProperties;
import com.scholary.slides.detection.BoundaryDetectorRegistry;
import com.scholary.slides.detection.DetectionMethod;
import com.scholary.slides.detection.TimeInterval;
import com.scholary.slides.frame.Frame;
import com.scholary.slides.frame.FrameImageWriter;
import com.scholary.slides.keyframe.CancellationToken;
import com.scholary.slides.keyframe.CandidateTimeline;
import com.scholary.slides.keyframe.FilterParameters;
import com.scholary.slides.keyframe.InvalidParametersException;
import com.scholary.slides.keyframe.KeyframeContext;
import com.scholary.slides.keyframe.KeyframePipeline;
import com.scholary.slides.keyframe.KeyframeResult;
import com.scholary.slides.keyframe.ProgressListener;
import com.scholary.slides.keyframe.RepresentativePolicy;
import com.scholary.slides.keyframe.TimeWindow;
import com.scholary.slides.media.CropRegion;
import com.scholary.slides.media.FrameSampler;
import com.scholary.slides.media.VideoProbe;
import com.scholary.slides.media.VideoSource;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates a complete keyframe extraction.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Resolve and validate the request into an {@link ExtractionPlan}
 *   <li>Probe the video
 *   <li>Detect content-change intervals on the cropped view
 *   <li>Run the keyframe pipeline
 *   <li>Write {@code slides/page_NNN.png}, plus {@code full/page_NNN.png} when full-screen pages
 *       are requested for a cropped video
 * </ol>
 */
@Service
public class KeyframeExtractionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeyframeExtractionService.class);

  static final String SLIDES_DIRECTORY = "slides";
  static final String FULL_SCREEN_DIRECTORY = "full";

  private final KeyframeProperties properties;
  private final VideoProbe videoProbe;
  private final BoundaryDetectorRegistry detectors;
  private final FrameSampler frameSampler;
  private final KeyframePipeline pipeline;
  private final FrameImageWriter imageWriter;

  public KeyframeExtractionService(
      KeyframeProperties properties,
      VideoProbe videoProbe,
      BoundaryDetectorRegistry detectors,
      FrameSampler frameSampler,
      KeyframePipeline pipeline,
      FrameImageWriter imageWriter) {
    this.properties = properties;
    this.videoProbe = videoProbe;
    this.detectors = detectors;
    this.frameSampler = frameSampler;
    this.pipeline = pipeline;
    this.imageWriter = imageWriter;
  }

  /**
   * Resolve a request over the configured defaults.
   *
   * @throws InvalidParametersException if any value is out of its domain
   */
  public ExtractionPlan plan(ExtractionRequest request) {
    KeyframeProperties.Defaults defaults = properties.defaults();
    FilterParameters parameters =
        new FilterParameters(
            orDefault(request.sceneThreshold(), defaults.sceneThreshold()),
            request.minSceneLength() != null
                ? request.minSceneLength()
                : defaults.minSceneLength(),
            orDefault(request.staticThreshold(), defaults.staticThreshold()),
            orDefault(request.duplicateThreshold(), defaults.duplicateThreshold()),
            orDefault(request.minGapSeconds(), defaults.minGapSeconds()),
            orDefault(request.maxGapSeconds(), defaults.maxGapSeconds()),
            orDefault(request.fillIntervalSeconds(), defaults.fillIntervalSeconds()));
    TimeWindow window = TimeWindow.parse(request.startTime(), request.endTime());
    CropRegion crop = CropRegion.parse(request.crop());
    DetectionMethod method =
        request.method() != null ? request.method() : defaults.detectionMethod();
    RepresentativePolicy policy =
        request.representativePolicy() != null
            ? request.representativePolicy()
            : defaults.representativePolicy();

    return new ExtractionPlan(
        toPath("videoPath", request.videoPath()),
        toPath("outputDir", request.outputDir()),
        crop,
        window,
        parameters,
        method,
        policy,
        request.fullScreen());
  }

  /** Plan and execute in one call. */
  public ExtractionReport extract(
      ExtractionRequest request, ProgressListener listener, CancellationToken cancellation)
      throws IOException {
    return execute(plan(request), listener, cancellation);
  }

  /**
   * Execute a plan.
   *
   * @param plan validated plan
   * @param listener progress and diagnostic channel
   * @param cancellation polled before every detector step and frame sample
   * @return the report of written pages
   * @throws IOException if probing, detection or page writing fails
   */
  public ExtractionReport execute(
      ExtractionPlan plan, ProgressListener listener, CancellationToken cancellation)
      throws IOException {
    FilterParameters parameters = plan.parameters();
    LOGGER.info(
        "Extracting keyframes: video={}, method={}, policy={}, parameters={}",
        plan.video(),
        plan.method(),
        plan.policy(),
        parameters);

    listener.onPhase(5, "probing");
    VideoSource video = videoProbe.open(plan.video(), plan.crop());

    listener.onPhase(15, "detecting");
    List<TimeInterval> intervals = detect(video, plan, cancellation);

    listener.onPhase(40, "selecting");
    KeyframeContext context =
        new KeyframeContext(parameters, plan.window(), plan.policy(), video.durationSeconds());
    try (KeyframeResult result =
        pipeline.run(intervals, frameSampler.sourceFor(video), context, listener, cancellation)) {

      listener.onPhase(85, "writing");
      List<Path> slidePages =
          imageWriter.writePages(
              result.frames(), plan.outputDirectory().resolve(SLIDES_DIRECTORY));

      List<Path> fullScreenPages = List.of();
      if (plan.fullScreen() && video.isCropped()) {
        fullScreenPages =
            writeFullScreenPages(
                video.uncropped(),
                result.timestamps(),
                plan.outputDirectory().resolve(FULL_SCREEN_DIRECTORY),
                cancellation);
      } else if (plan.fullScreen()) {
        LOGGER.info("Full-screen pages requested without a crop; slide pages are full-screen");
      }

      LOGGER.info(
          "Extraction finished: {} keyframes, degraded={}, counts={}",
          result.size(),
          result.degradedDetection(),
          result.stageCounts());
      return new ExtractionReport(
          result.timestamps(),
          slidePages.stream().map(Path::toString).toList(),
          fullScreenPages.stream().map(Path::toString).toList(),
          result.degradedDetection(),
          result.stageCounts());
    }
  }

  /**
   * Detect and build the candidate timeline without sampling any frame.
   *
   * <p>Frame-based filters are skipped, so the candidates are an upper bound of the keyframes a
   * full run would produce. Useful for tuning the gap parameters.
   */
  public CandidatePreview previewCandidates(
      ExtractionRequest request, CancellationToken cancellation) throws IOException {
    ExtractionPlan plan = plan(request);
    VideoSource video = videoProbe.open(plan.video(), plan.crop());
    List<TimeInterval> intervals = detect(video, plan, cancellation);
    KeyframeContext context =
        new KeyframeContext(
            plan.parameters(), plan.window(), plan.policy(), video.durationSeconds());
    CandidateTimeline timeline = pipeline.preview(intervals, context);
    return new CandidatePreview(video.durationSeconds(), intervals.size(), timeline);
  }

  private List<TimeInterval> detect(
      VideoSource video, ExtractionPlan plan, CancellationToken cancellation) throws IOException {
    FilterParameters parameters = plan.parameters();
    return detectors
        .forMethod(plan.method())
        .detect(
            video,
            parameters.boundarySensitivity(),
            parameters.minBoundaryGapFrames(),
            cancellation);
  }

  /** Re-sample the retained timestamps from the uncropped video. */
  private List<Path> writeFullScreenPages(
      VideoSource video, List<Double> timestamps, Path directory, CancellationToken cancellation)
      throws IOException {
    List<Frame> frames = new ArrayList<>(timestamps.size());
    try {
      for (double timestamp : timestamps) {
        cancellation.throwIfCancellationRequested();
        Optional<Frame> frame = frameSampler.sample(video, timestamp);
        if (frame.isPresent() && frame.get().isReadable()) {
          frames.add(frame.get());
        } else {
          frame.ifPresent(Frame::close);
          LOGGER.warn("Skipping unreadable full-screen frame at {}s", timestamp);
        }
      }
      return imageWriter.writePages(frames, directory);
    } finally {
      frames.forEach(Frame::release);
    }
  }

  private static double orDefault(Double value, double fallback) {
    return value != null ? value : fallback;
  }

  private static Path toPath(String name, String value) {
    try {
      return Path.of(value);
    } catch (InvalidPathException e) {
      throw new InvalidParametersException("Invalid " + name + ": " + value, e);
    }
  }
}
