package com.scholary.slides.frame;

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Loads the OpenCV native library bundled with the openpnp distribution, once per JVM. */
public final class OpenCvLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenCvLoader.class);

  private static boolean loaded;

  private OpenCvLoader() {}

  public static synchronized void ensureLoaded() {
    if (loaded) {
      return;
    }
    nu.pattern.OpenCV.loadLocally();
    loaded = true;
    LOGGER.info("OpenCV loaded successfully: version={}", Core.VERSION);
  }
}
