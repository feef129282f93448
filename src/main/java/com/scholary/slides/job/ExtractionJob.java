package com.scholary.slides.job;

import com.scholary.slides.api.JobStatusResponse;
import com.scholary.slides.api.JobStatusResponse.Status;
import com.scholary.slides.keyframe.CancellationToken;
import com.scholary.slides.service.ExtractionPlan;
import com.scholary.slides.service.ExtractionReport;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Represents an async extraction job.
 *
 * <p>Tracks the job's state, progress, and result. Stored in memory using Caffeine cache. Written
 * by the worker thread and read by request threads, so the mutable state is volatile.
 */
public class ExtractionJob {

  private final String jobId;
  private final ExtractionPlan plan;
  private final Duration maxRunTime;
  private final AtomicBoolean cancelRequested = new AtomicBoolean();

  private volatile Status status;
  private volatile int progress; // 0-100
  private volatile String message;
  private volatile boolean degradedDetection;
  private volatile ExtractionReport result;
  private volatile String error;

  /**
   * @param maxRunTime deadline counted from the start of processing, null for none
   */
  public ExtractionJob(String jobId, ExtractionPlan plan, Duration maxRunTime) {
    this.jobId = jobId;
    this.plan = plan;
    this.maxRunTime = maxRunTime;
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public ExtractionPlan getPlan() {
    return plan;
  }

  public void requestCancel() {
    cancelRequested.set(true);
  }

  public boolean isCancelRequested() {
    return cancelRequested.get();
  }

  /** The token a run of this job polls: cancelled on request or once the deadline passes. */
  public CancellationToken startCancellationToken(Clock clock) {
    CancellationToken token = this::isCancelRequested;
    if (maxRunTime != null) {
      token = token.or(CancellationToken.deadline(clock.instant().plus(maxRunTime), clock));
    }
    return token;
  }

  public boolean isFinished() {
    return status == Status.COMPLETED || status == Status.FAILED || status == Status.CANCELLED;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public int getProgress() {
    return progress;
  }

  public void setProgress(int progress) {
    this.progress = progress;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public boolean isDegradedDetection() {
    return degradedDetection;
  }

  public void setDegradedDetection(boolean degradedDetection) {
    this.degradedDetection = degradedDetection;
  }

  public ExtractionReport getResult() {
    return result;
  }

  public void setResult(ExtractionReport result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  public JobStatusResponse toResponse() {
    return new JobStatusResponse(
        jobId, status, progress, message, degradedDetection, result, error);
  }
}
