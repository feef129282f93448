package com.scholary.slides.api;

import com.scholary.slides.service.SweepOutcome;
import java.util.List;

/** Sweep results, ordered by keyframe count descending. */
public record SweepResponse(List<SweepOutcome> results) {}
