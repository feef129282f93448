package com.scholary.slides.keyframe;

/** Thrown at a cancellation point once the caller has asked a run to stop. */
public class ExtractionCancelledException extends RuntimeException {

  public ExtractionCancelledException(String message) {
    super(message);
  }
}
