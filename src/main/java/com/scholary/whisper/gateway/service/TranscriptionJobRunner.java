package com.scholary.whisper.gateway.service;

import com.scholary.whisper.gateway.api.JobStatusResponse.Status;
import com.scholary.whisper.gateway.job.JobRepository;
import com.scholary.whisper.gateway.job.TranscriptionJob;
import com.scholary.whisper.gateway.logging.StructuredLogger;
import com.scholary.whisper.gateway.whisper.TranscriptionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs async transcription jobs on the {@code taskExecutor} pool.
 *
 * <p>A separate bean from the controller so that Spring's async proxy actually applies.
 */
@Service
public class TranscriptionJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobRunner.class);

  private final TranscriptionService transcriptionService;
  private final JobRepository jobRepository;
  private final StructuredLogger events = new StructuredLogger(LOGGER);

  public TranscriptionJobRunner(
      TranscriptionService transcriptionService, JobRepository jobRepository) {
    this.transcriptionService = transcriptionService;
    this.jobRepository = jobRepository;
  }

  /** Process a job. The job's status is updated as processing progresses. */
  @Async
  public void run(TranscriptionJob job) {
    StructuredLogger.setJobContext(job.getJobId());
    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);
      events.logJobStatus(job.getJobId(), Status.PROCESSING.name(), "");

      TranscriptionResult result =
          transcriptionService.transcribe(job.getUpload(), job.getOptions());

      job.setResult(result);
      job.setStatus(Status.COMPLETED);
      events.logJobStatus(job.getJobId(), Status.COMPLETED.name(), "");

    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setError(e.getMessage());
      job.setStatus(Status.FAILED);
      events.logJobStatus(job.getJobId(), Status.FAILED.name(), e.getMessage());
    } finally {
      job.releaseUpload();
      jobRepository.save(job);
      StructuredLogger.clearJobContext();
    }
  }
}
