package com.scholary.slides.config;

import com.scholary.slides.detection.DetectionMethod;
import com.scholary.slides.keyframe.RepresentativePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for keyframe extraction.
 *
 * <p>Request values override {@link Defaults} field by field.
 */
@ConfigurationProperties(prefix = "keyframe")
@Validated
public record KeyframeProperties(
    @NotNull @Valid Defaults defaults,
    @NotNull @Valid Evp evp,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  public record Defaults(
      @Positive double sceneThreshold,
      @Positive int minSceneLength,
      @PositiveOrZero double staticThreshold,
      @PositiveOrZero double duplicateThreshold,
      @PositiveOrZero double minGapSeconds,
      @PositiveOrZero double maxGapSeconds,
      @PositiveOrZero double fillIntervalSeconds,
      @NotNull RepresentativePolicy representativePolicy,
      @NotNull DetectionMethod detectionMethod) {}

  public record Evp(@Positive double sampleStepSeconds) {}
}
