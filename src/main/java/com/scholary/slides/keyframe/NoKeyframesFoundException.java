package com.scholary.slides.keyframe;

/**
 * Thrown when consolidation ends with nothing to assemble.
 *
 * <p>This is the only fatal outcome of the selection pipeline itself. Earlier stages degrade to a
 * single fallback candidate instead of failing, so this surfaces only when even the fallback could
 * not produce a readable frame (for example a zero-length video).
 */
public class NoKeyframesFoundException extends RuntimeException {

  public NoKeyframesFoundException(String message) {
    super(message);
  }
}
