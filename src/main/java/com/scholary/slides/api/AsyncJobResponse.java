package com.scholary.slides.api;

/**
 * Response for an async extraction request.
 *
 * <p>Returns a job ID that can be used to poll for status or to cancel the job.
 */
public record AsyncJobResponse(String jobId) {}
