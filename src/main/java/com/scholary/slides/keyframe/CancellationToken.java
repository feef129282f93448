package com.scholary.slides.keyframe;

import java.time.Clock;
import java.time.Instant;

/**
 * Cooperative cancellation signal for a pipeline run.
 *
 * <p>The pipeline polls the token before every frame sample and before every detector step, never
 * in the middle of a frame metric computation. A run that observes a cancelled token aborts with
 * {@link ExtractionCancelledException}.
 */
@FunctionalInterface
public interface CancellationToken {

  CancellationToken NONE = () -> false;

  boolean isCancellationRequested();

  default void throwIfCancellationRequested() {
    if (isCancellationRequested()) {
      throw new ExtractionCancelledException("Keyframe extraction was cancelled");
    }
  }

  /** Combine two tokens; the result is cancelled as soon as either one is. */
  default CancellationToken or(CancellationToken other) {
    return () -> isCancellationRequested() || other.isCancellationRequested();
  }

  /**
   * A token that trips once the clock reaches the deadline.
   *
   * @param deadline the instant after which the run should stop
   * @param clock the clock to read
   * @return a deadline token
   */
  static CancellationToken deadline(Instant deadline, Clock clock) {
    return () -> !clock.instant().isBefore(deadline);
  }
}
