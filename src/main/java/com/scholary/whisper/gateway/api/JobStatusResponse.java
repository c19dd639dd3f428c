package com.scholary.whisper.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.whisper.gateway.whisper.TranscriptionResult;

/**
 * Response for job status query.
 *
 * <p>Carries the transcription once the job is completed and the error message once it failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
    String jobId, Status status, TranscriptionResult result, String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
