package com.scholary.slides.keyframe;

import com.scholary.slides.frame.Frame;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a caller's frame source with the pipeline's sampling rules.
 *
 * <p>Checks the cancellation token before every sample. A sampling failure or an unreadable frame
 * becomes an empty result plus an {@link PipelineDiagnostic#UNREADABLE_FRAME} diagnostic, so a
 * single bad frame never fails the run.
 */
class GuardedFrameSource implements FrameSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(GuardedFrameSource.class);

  private final FrameSource delegate;
  private final ProgressListener listener;
  private final CancellationToken cancellation;

  GuardedFrameSource(
      FrameSource delegate, ProgressListener listener, CancellationToken cancellation) {
    this.delegate = delegate;
    this.listener = listener;
    this.cancellation = cancellation;
  }

  @Override
  public Optional<Frame> sampleAt(double timestampSeconds) {
    cancellation.throwIfCancellationRequested();

    Optional<Frame> sampled;
    try {
      sampled = delegate.sampleAt(timestampSeconds);
    } catch (ExtractionCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      LOGGER.warn("Frame sampling failed at {}s: {}", timestampSeconds, e.getMessage());
      sampled = Optional.empty();
    }

    if (sampled == null || sampled.isEmpty()) {
      listener.onDiagnostic(
          PipelineDiagnostic.UNREADABLE_FRAME, timestampSeconds, "frame could not be sampled");
      return Optional.empty();
    }
    Frame frame = sampled.get();
    if (!frame.isReadable()) {
      frame.close();
      listener.onDiagnostic(
          PipelineDiagnostic.UNREADABLE_FRAME, timestampSeconds, "frame holds no pixels");
      return Optional.empty();
    }
    return sampled;
  }
}
