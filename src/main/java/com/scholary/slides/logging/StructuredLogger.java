package com.scholary.slides.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts an {@code event_type} and its fields into the MDC for the duration of one log
 * call, so log shippers can index pipeline decisions without parsing messages.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log boundary normalization result. */
  public void logCandidatesNormalized(int intervals, int candidates, String policy) {
    try {
      MDC.put("event_type", "candidates_normalized");
      MDC.put("intervals", String.valueOf(intervals));
      MDC.put("candidates", String.valueOf(candidates));
      MDC.put("policy", policy);

      logger.info(
          "Candidates normalized: intervals={}, candidates={}, policy={}",
          intervals,
          candidates,
          policy);
    } finally {
      clearEventFields();
    }
  }

  /** Log a candidate rejected by a filter stage. */
  public void logCandidateDropped(String stage, double timestamp, double score, double threshold) {
    try {
      MDC.put("event_type", "candidate_dropped");
      MDC.put("stage", stage);
      MDC.put("timestamp", String.valueOf(timestamp));
      MDC.put("score", String.valueOf(score));
      MDC.put("threshold", String.valueOf(threshold));

      logger.debug(
          "Candidate dropped: stage={}, t={}s, score={}, threshold={}",
          stage,
          timestamp,
          score,
          threshold);
    } finally {
      clearEventFields();
    }
  }

  /** Log synthetic candidates inserted into a long gap. */
  public void logGapFilled(double start, double end, int inserted) {
    try {
      MDC.put("event_type", "gap_filled");
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("inserted", String.valueOf(inserted));

      logger.debug("Gap filled: range=[{}-{}], inserted={}", start, end, inserted);
    } finally {
      clearEventFields();
    }
  }

  /** Log the single-candidate fallback taken when detection yielded nothing usable. */
  public void logDegradedDetection(int candidatesIn, double fallbackTimestamp) {
    try {
      MDC.put("event_type", "degraded_detection");
      MDC.put("candidates", String.valueOf(candidatesIn));
      MDC.put("timestamp", String.valueOf(fallbackTimestamp));

      logger.warn(
          "Degraded detection: no candidate survived filtering (input={}), falling back to {}s",
          candidatesIn,
          fallbackTimestamp);
    } finally {
      clearEventFields();
    }
  }

  /** Log the consolidation result. */
  public void logKeyframesConsolidated(int received, int kept, int unreadable) {
    try {
      MDC.put("event_type", "keyframes_consolidated");
      MDC.put("candidates", String.valueOf(received));
      MDC.put("kept", String.valueOf(kept));
      MDC.put("unreadable", String.valueOf(unreadable));

      logger.info(
          "Keyframes consolidated: received={}, kept={}, unreadable={}",
          received,
          kept,
          unreadable);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int percentComplete, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("jobId", jobId);
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info("Job progress: jobId={}, phase={}, progress={}%", jobId, phase, percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String video) {
    MDC.put("jobId", jobId);
    MDC.put("video", video);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("video");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("intervals");
    MDC.remove("candidates");
    MDC.remove("policy");
    MDC.remove("stage");
    MDC.remove("timestamp");
    MDC.remove("score");
    MDC.remove("threshold");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("inserted");
    MDC.remove("kept");
    MDC.remove("unreadable");
    MDC.remove("percentComplete");
    MDC.remove("phase");
  }
}
