package com.scholary.whisper.gateway.job;

import com.scholary.whisper.gateway.api.JobStatusResponse.Status;
import com.scholary.whisper.gateway.service.AudioUpload;
import com.scholary.whisper.gateway.service.TranscriptionOptions;
import com.scholary.whisper.gateway.whisper.TranscriptionResult;
import java.time.Instant;

/**
 * Represents an async transcription job.
 *
 * <p>Written by one worker thread, read by HTTP threads polling for status. The upload is dropped
 * once the job has run so finished jobs do not pin audio in memory.
 */
public class TranscriptionJob {

  private final String jobId;
  private final TranscriptionOptions options;
  private final Instant createdAt;

  private volatile AudioUpload upload;
  private volatile Status status;
  private volatile TranscriptionResult result;
  private volatile String error;

  public TranscriptionJob(String jobId, AudioUpload upload, TranscriptionOptions options) {
    this.jobId = jobId;
    this.upload = upload;
    this.options = options;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public AudioUpload getUpload() {
    return upload;
  }

  public void releaseUpload() {
    this.upload = null;
  }

  public TranscriptionOptions getOptions() {
    return options;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public TranscriptionResult getResult() {
    return result;
  }

  public void setResult(TranscriptionResult result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
