package com.scholary.slides.keyframe;

/**
 * Candidate counts after each pipeline stage of one run.
 *
 * @param detectedIntervals intervals reported by the detector
 * @param normalized candidates after normalization
 * @param filtered candidates after temporal filtering, including a fallback candidate
 * @param gapFilled candidates after gap filling
 * @param consolidated final keyframes
 */
public record StageCounts(
    int detectedIntervals, int normalized, int filtered, int gapFilled, int consolidated) {}
