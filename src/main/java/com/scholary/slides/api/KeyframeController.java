package com.scholary.slides.api;

import com.scholary.slides.job.ExtractionJob;
import com.scholary.slides.job.ExtractionJobRunner;
import com.scholary.slides.job.JobRepository;
import com.scholary.slides.keyframe.CancellationToken;
import com.scholary.slides.keyframe.InvalidParametersException;
import com.scholary.slides.service.ExtractionPlan;
import com.scholary.slides.service.KeyframeExtractionService;
import com.scholary.slides.service.ParameterSweepService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for slide keyframe extraction.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Asynchronous extraction (returns job ID immediately)
 *   <li>Job status polling and cancellation
 *   <li>Previewing the candidate timeline
 *   <li>Parameter sweeps
 * </ul>
 */
@RestController
@Tag(name = "Keyframes", description = "Slide keyframe extraction API")
public class KeyframeController {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeyframeController.class);

  private final KeyframeExtractionService extractionService;
  private final ParameterSweepService sweepService;
  private final JobRepository jobRepository;
  private final ExtractionJobRunner jobRunner;

  public KeyframeController(
      KeyframeExtractionService extractionService,
      ParameterSweepService sweepService,
      JobRepository jobRepository,
      ExtractionJobRunner jobRunner) {
    this.extractionService = extractionService;
    this.sweepService = sweepService;
    this.jobRepository = jobRepository;
    this.jobRunner = jobRunner;
  }

  /** Start asynchronous extraction job. */
  @PostMapping("/api/keyframes/extract")
  @Operation(
      summary = "Start extraction",
      description = "Validate the request, start an async extraction job and return its ID")
  public ResponseEntity<AsyncJobResponse> extract(@Valid @RequestBody ExtractionRequest request) {
    ExtractionPlan plan = extractionService.plan(request);
    String jobId = UUID.randomUUID().toString();
    Duration maxRunTime =
        request.maxRunSeconds() != null ? Duration.ofSeconds(request.maxRunSeconds()) : null;

    ExtractionJob job = new ExtractionJob(jobId, plan, maxRunTime);
    jobRepository.save(job);
    LOGGER.info("Created async extraction job: {} for {}", jobId, plan.video());

    jobRunner.run(job);
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  /** Get job status, including the report once completed. */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an extraction job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(job.toResponse()))
        .orElse(ResponseEntity.notFound().build());
  }

  /**
   * Request cancellation of a job.
   *
   * <p>Cancellation is cooperative: the job stops at its next frame sample or detector step.
   */
  @DeleteMapping("/api/jobs/{id}")
  @Operation(summary = "Cancel job", description = "Request cooperative cancellation of a job")
  public ResponseEntity<JobStatusResponse> cancelJob(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job -> {
              if (!job.isFinished()) {
                job.requestCancel();
                LOGGER.info("Cancellation requested for job: {}", id);
              }
              return ResponseEntity.accepted().body(job.toResponse());
            })
        .orElse(ResponseEntity.notFound().build());
  }

  /** Preview candidate timestamps without sampling frames. */
  @PostMapping("/api/keyframes/preview")
  @Operation(
      summary = "Preview candidates",
      description = "Run detection and candidate planning only, without decoding frames")
  public ResponseEntity<CandidatePreviewResponse> preview(
      @Valid @RequestBody ExtractionRequest request) {
    try {
      return ResponseEntity.ok(
          CandidatePreviewResponse.from(
              extractionService.previewCandidates(request, CancellationToken.NONE)));
    } catch (IOException e) {
      LOGGER.error("Failed to preview candidates for {}", request.videoPath(), e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  /** Run a synchronous parameter sweep. */
  @PostMapping("/api/keyframes/sweep")
  @Operation(
      summary = "Parameter sweep",
      description = "Extract once per preset and report keyframe counts, most first")
  public ResponseEntity<SweepResponse> sweep(@Valid @RequestBody SweepRequest request) {
    return ResponseEntity.ok(
        new SweepResponse(
            sweepService.sweep(request.base(), request.presets(), CancellationToken.NONE)));
  }

  @ExceptionHandler(InvalidParametersException.class)
  public ProblemDetail handleInvalidParameters(InvalidParametersException e) {
    LOGGER.warn("Rejected request: {}", e.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
  }
}
