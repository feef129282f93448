package com.scholary.slides.detection;

/** Available scene-boundary detection backends. */
public enum DetectionMethod {
  /** ffmpeg's scene-change score over the whole stream. */
  SCENE_CONTENT,

  /** Fixed-step frame sampling with frame-to-frame dissimilarity. */
  EVP
}
