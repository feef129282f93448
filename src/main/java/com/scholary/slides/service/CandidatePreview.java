package com.scholary.slides.service;

import com.scholary.slides.keyframe.CandidateTimeline;

/** Detection output and the candidate timeline derived from it, without frame sampling. */
public record CandidatePreview(
    double durationSeconds, int detectedIntervals, CandidateTimeline timeline) {}
