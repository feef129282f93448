package com.scholary.slides.api;

import com.scholary.slides.service.ExtractionReport;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the report if completed.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    Integer progress,
    String message,
    boolean degradedDetection,
    ExtractionReport result,
    String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
  }
}
