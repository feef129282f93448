package com.scholary.slides.keyframe;

/**
 * Optional diagnostic channel for a pipeline run.
 *
 * <p>Non-fatal conditions never escape as exceptions; this listener is the only place they are
 * observable.
 */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = message -> {};

  void onProgress(String message);

  /** Coarse progress of a whole extraction, 0 to 100. */
  default void onPhase(int percentComplete, String phase) {
    onProgress(phase);
  }

  default void onDiagnostic(PipelineDiagnostic diagnostic, double timestampSeconds, String detail) {
    onProgress(String.format("%s at %.3fs: %s", diagnostic, timestampSeconds, detail));
  }
}
