package com.scholary.whisper.gateway.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.scholary.whisper.gateway.api.JobStatusResponse.Status;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory store for async transcription jobs.
 *
 * <p>Bounded by {@code jobstore.maxSize}; a job expires {@code jobstore.expireAfterMinutes} after
 * its last status update. Jobs do not survive a restart.
 */
@Repository
public class JobRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRepository.class);

  private final Cache<String, TranscriptionJob> jobs;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.jobs =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .removalListener(JobRepository::onRemoval)
            .build();
  }

  public void save(TranscriptionJob job) {
    jobs.put(job.getJobId(), job);
  }

  public Optional<TranscriptionJob> findById(String jobId) {
    return Optional.ofNullable(jobs.getIfPresent(jobId));
  }

  /**
   * Drop a job that will never run, e.g. because the worker pool refused it. Pollers get a 404
   * instead of a job stuck in PENDING.
   */
  public void discard(String jobId) {
    jobs.invalidate(jobId);
  }

  // A poller loses track of a job evicted before it finished.
  private static void onRemoval(String jobId, TranscriptionJob job, RemovalCause cause) {
    if (job == null || !cause.wasEvicted()) {
      return;
    }
    if (job.getStatus() == Status.PENDING || job.getStatus() == Status.PROCESSING) {
      LOGGER.warn("Evicted unfinished job {} ({}, status={})", jobId, cause, job.getStatus());
    } else {
      LOGGER.debug("Evicted job {} ({})", jobId, cause);
    }
  }
}
