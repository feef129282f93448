package com.scholary.slides.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg and ffprobe invocations.
 *
 * @param ffmpegPath ffmpeg executable, resolved through PATH when not absolute
 * @param ffprobePath ffprobe executable
 * @param sampleTimeout upper bound for decoding a single frame
 * @param probeTimeout upper bound for a metadata probe
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @NotNull Duration sampleTimeout,
    @NotNull Duration probeTimeout) {}
