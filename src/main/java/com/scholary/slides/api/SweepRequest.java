package com.scholary.slides.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request for a parameter sweep.
 *
 * @param base video, output directory, crop and window shared by all runs; tuning fields are
 *     ignored
 * @param presets preset names to run, null or empty for all presets
 */
public record SweepRequest(@NotNull @Valid ExtractionRequest base, List<String> presets) {

  public SweepRequest {
    presets = presets == null ? List.of() : List.copyOf(presets);
  }
}
