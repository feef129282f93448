package com.scholary.slides.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * Extraction jobs by id, kept in a bounded Caffeine cache.
 *
 * <p>The runner saves a job on every phase change, so expiry counts from the last progress update
 * of a running job and from completion of a finished one. Pages stay on disk after a job expires;
 * only its status and report are forgotten.
 */
@Repository
public class JobRepository {

  private final Cache<String, ExtractionJob> jobs;

  public JobRepository(
      @Value("${jobstore.max-size}") int maxJobs,
      @Value("${jobstore.expire-after-minutes}") int expireAfterMinutes) {
    this(maxJobs, Duration.ofMinutes(expireAfterMinutes), Ticker.systemTicker());
  }

  JobRepository(int maxJobs, Duration expireAfterUpdate, Ticker ticker) {
    this.jobs =
        Caffeine.newBuilder()
            .maximumSize(maxJobs)
            .expireAfterWrite(expireAfterUpdate)
            .ticker(ticker)
            .build();
  }

  /** Store a new job or record an update to a known one. */
  public void save(ExtractionJob job) {
    jobs.put(job.getJobId(), job);
  }

  public Optional<ExtractionJob> findById(String jobId) {
    return Optional.ofNullable(jobs.getIfPresent(jobId));
  }
}
