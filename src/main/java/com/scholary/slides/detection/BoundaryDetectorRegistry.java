package com.scholary.slides.detection;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Resolves a {@link DetectionMethod} to its detector bean. */
@Component
public class BoundaryDetectorRegistry {

  private final Map<DetectionMethod, SceneBoundaryDetector> detectors =
      new EnumMap<>(DetectionMethod.class);

  public BoundaryDetectorRegistry(List<SceneBoundaryDetector> detectors) {
    for (SceneBoundaryDetector detector : detectors) {
      SceneBoundaryDetector previous = this.detectors.put(detector.method(), detector);
      if (previous != null) {
        throw new IllegalStateException("Two detectors registered for " + detector.method());
      }
    }
  }

  public SceneBoundaryDetector forMethod(DetectionMethod method) {
    SceneBoundaryDetector detector = detectors.get(method);
    if (detector == null) {
      throw new IllegalStateException("No detector available for " + method);
    }
    return detector;
  }
}
