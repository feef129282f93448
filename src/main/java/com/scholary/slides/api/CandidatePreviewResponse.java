package com.scholary.slides.api;

import com.scholary.slides.service.CandidatePreview;
import java.util.List;

/**
 * Response for candidate preview request.
 *
 * <p>Shows where keyframes would be sampled without decoding a single frame.
 */
public record CandidatePreviewResponse(
    double durationSeconds,
    int detectedIntervals,
    List<Double> normalized,
    List<Double> coalesced,
    List<Double> candidates) {

  static CandidatePreviewResponse from(CandidatePreview preview) {
    return new CandidatePreviewResponse(
        preview.durationSeconds(),
        preview.detectedIntervals(),
        preview.timeline().normalized(),
        preview.timeline().coalesced(),
        preview.timeline().gapFilled());
  }
}
