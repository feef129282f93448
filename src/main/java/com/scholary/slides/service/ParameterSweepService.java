package com.scholary.slides.service;

import com.scholary.slides.api.ExtractionRequest;
import com.scholary.slides.keyframe.CancellationToken;
import com.scholary.slides.keyframe.ExtractionCancelledException;
import com.scholary.slides.keyframe.InvalidParametersException;
import com.scholary.slides.keyframe.ProgressListener;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the same extraction under several presets to help pick a tuning for a recording.
 *
 * <p>Each preset writes into its own sub-directory of the request's output directory. A failing
 * preset is recorded with a count of -1 and does not stop the sweep.
 */
@Service
public class ParameterSweepService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParameterSweepService.class);

  private final KeyframeExtractionService extractionService;
  private final Map<String, SweepPreset> presets = new LinkedHashMap<>();

  public ParameterSweepService(KeyframeExtractionService extractionService) {
    this.extractionService = extractionService;
    SweepPreset.defaults().forEach(preset -> presets.put(preset.name(), preset));
  }

  public List<String> presetNames() {
    return List.copyOf(presets.keySet());
  }

  /**
   * Run the sweep.
   *
   * @param base video, output directory, crop and window shared by every run
   * @param presetNames presets to run, empty for all
   * @param cancellation stops the sweep between or inside runs
   * @return one outcome per preset, most keyframes first
   * @throws InvalidParametersException if the base request or a preset name is invalid
   */
  public List<SweepOutcome> sweep(
      ExtractionRequest base, List<String> presetNames, CancellationToken cancellation) {
    ExtractionPlan basePlan = extractionService.plan(base);
    List<SweepPreset> selected = select(presetNames);

    LOGGER.info("Starting sweep of {} presets on {}", selected.size(), basePlan.video());
    List<SweepOutcome> outcomes = new ArrayList<>(selected.size());
    for (SweepPreset preset : selected) {
      Path outputDirectory = basePlan.outputDirectory().resolve(preset.name());
      ExtractionPlan plan =
          basePlan.withParameters(preset.parameters()).withOutputDirectory(outputDirectory);
      try {
        ExtractionReport report =
            extractionService.execute(plan, ProgressListener.NONE, cancellation);
        LOGGER.info("Preset {}: {} keyframes", preset.name(), report.keyframeCount());
        outcomes.add(SweepOutcome.success(preset, outputDirectory.toString(), report));
      } catch (ExtractionCancelledException e) {
        throw e;
      } catch (IOException | RuntimeException e) {
        LOGGER.warn("Preset {} failed: {}", preset.name(), e.getMessage());
        outcomes.add(SweepOutcome.failure(preset, outputDirectory.toString(), e.getMessage()));
      }
    }

    outcomes.sort(Comparator.comparingInt(SweepOutcome::keyframeCount).reversed());
    return outcomes;
  }

  private List<SweepPreset> select(List<String> names) {
    if (names == null || names.isEmpty()) {
      return List.copyOf(presets.values());
    }
    List<SweepPreset> selected = new ArrayList<>(names.size());
    for (String name : names) {
      SweepPreset preset = presets.get(name);
      if (preset == null) {
        throw new InvalidParametersException(
            "Unknown sweep preset '" + name + "', expected one of " + presets.keySet());
      }
      selected.add(preset);
    }
    return selected;
  }
}
