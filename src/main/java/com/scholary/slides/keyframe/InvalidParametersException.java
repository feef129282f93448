package com.scholary.slides.keyframe;

/**
 * Thrown when extraction parameters fall outside their documented domains.
 *
 * <p>Raised before any detection or frame sampling starts, so a bad request never costs decode
 * work.
 */
public class InvalidParametersException extends IllegalArgumentException {

  public InvalidParametersException(String message) {
    super(message);
  }

  public InvalidParametersException(String message, Throwable cause) {
    super(message, cause);
  }
}
