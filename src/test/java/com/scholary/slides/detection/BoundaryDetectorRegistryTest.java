package com.scholary.slides.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.Test;

class BoundaryDetectorRegistryTest {

  @Test
  void forMethod_shouldResolveRegisteredDetector() {
    SceneBoundaryDetector scene = detector(DetectionMethod.SCENE_CONTENT);
    SceneBoundaryDetector evp = detector(DetectionMethod.EVP);

    BoundaryDetectorRegistry registry = new BoundaryDetectorRegistry(List.of(scene, evp));

    assertThat(registry.forMethod(DetectionMethod.SCENE_CONTENT)).isSameAs(scene);
    assertThat(registry.forMethod(DetectionMethod.EVP)).isSameAs(evp);
  }

  @Test
  void forMethod_shouldFailForMissingDetector() {
    BoundaryDetectorRegistry registry =
        new BoundaryDetectorRegistry(List.of(detector(DetectionMethod.SCENE_CONTENT)));

    assertThatThrownBy(() -> registry.forMethod(DetectionMethod.EVP))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("EVP");
  }

  @Test
  void constructor_shouldRejectDuplicateRegistration() {
    List<SceneBoundaryDetector> detectors =
        List.of(detector(DetectionMethod.EVP), detector(DetectionMethod.EVP));

    assertThatThrownBy(() -> new BoundaryDetectorRegistry(detectors))
        .isInstanceOf(IllegalStateException.class);
  }

  private static SceneBoundaryDetector detector(DetectionMethod method) {
    SceneBoundaryDetector detector = mock(SceneBoundaryDetector.class);
    when(detector.method()).thenReturn(method);
    return detector;
  }
}
