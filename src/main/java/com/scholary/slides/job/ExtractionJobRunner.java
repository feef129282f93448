package com.scholary.slides.job;

import com.scholary.slides.api.JobStatusResponse.Status;
import com.scholary.slides.keyframe.ExtractionCancelledException;
import com.scholary.slides.keyframe.NoKeyframesFoundException;
import com.scholary.slides.keyframe.PipelineDiagnostic;
import com.scholary.slides.keyframe.ProgressListener;
import com.scholary.slides.logging.StructuredLogger;
import com.scholary.slides.service.ExtractionReport;
import com.scholary.slides.service.KeyframeExtractionService;
import java.io.IOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs extraction jobs on the async executor.
 *
 * <p>Lives in its own bean so that {@link Async} goes through the Spring proxy.
 */
@Component
public class ExtractionJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionJobRunner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final KeyframeExtractionService extractionService;
  private final JobRepository jobRepository;
  private final Clock clock;

  public ExtractionJobRunner(
      KeyframeExtractionService extractionService, JobRepository jobRepository) {
    this(extractionService, jobRepository, Clock.systemUTC());
  }

  ExtractionJobRunner(
      KeyframeExtractionService extractionService, JobRepository jobRepository, Clock clock) {
    this.extractionService = extractionService;
    this.jobRepository = jobRepository;
    this.clock = clock;
  }

  /**
   * Process a job.
   *
   * <p>Every outcome, including cancellation, ends in a terminal status saved to the repository.
   */
  @Async
  public void run(ExtractionJob job) {
    StructuredLogger.setJobContext(job.getJobId(), job.getPlan().video().toString());
    LOGGER.info("Starting async processing for job: {}", job.getJobId());
    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      ExtractionReport report =
          extractionService.execute(
              job.getPlan(), progressListener(job), job.startCancellationToken(clock));

      job.setResult(report);
      job.setDegradedDetection(report.degradedDetection());
      job.setProgress(100);
      job.setMessage(String.format("Extracted %d keyframes", report.keyframeCount()));
      job.setStatus(Status.COMPLETED);
      structuredLogger.logJobProgress(job.getJobId(), 100, "completed");

    } catch (ExtractionCancelledException e) {
      LOGGER.info("Job {} cancelled: {}", job.getJobId(), e.getMessage());
      job.setStatus(Status.CANCELLED);
      job.setError(e.getMessage());
    } catch (NoKeyframesFoundException e) {
      LOGGER.warn("Job {} found no keyframes: {}", job.getJobId(), e.getMessage());
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
    } finally {
      jobRepository.save(job);
      StructuredLogger.clearJobContext();
    }
  }

  private ProgressListener progressListener(ExtractionJob job) {
    return new ProgressListener() {
      @Override
      public void onProgress(String message) {
        job.setMessage(message);
      }

      @Override
      public void onPhase(int percentComplete, String phase) {
        job.setProgress(percentComplete);
        job.setMessage(phase);
        structuredLogger.logJobProgress(job.getJobId(), percentComplete, phase);
        jobRepository.save(job);
      }

      @Override
      public void onDiagnostic(
          PipelineDiagnostic diagnostic, double timestampSeconds, String detail) {
        if (diagnostic == PipelineDiagnostic.DEGRADED_DETECTION) {
          job.setDegradedDetection(true);
        }
        ProgressListener.super.onDiagnostic(diagnostic, timestampSeconds, detail);
      }
    };
  }
}
