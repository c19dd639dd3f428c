package com.scholary.whisper.gateway.api;

import com.scholary.whisper.gateway.job.JobRepository;
import com.scholary.whisper.gateway.job.TranscriptionJob;
import com.scholary.whisper.gateway.logging.StructuredLogger;
import com.scholary.whisper.gateway.service.AudioUpload;
import com.scholary.whisper.gateway.service.TranscriptionJobRunner;
import com.scholary.whisper.gateway.service.TranscriptionOptions;
import com.scholary.whisper.gateway.service.TranscriptionService;
import com.scholary.whisper.gateway.whisper.ModelsResult;
import com.scholary.whisper.gateway.whisper.TranscriptionResult;
import com.scholary.whisper.gateway.whisper.WhisperTask;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for audio transcription.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Listing the backend's models
 *   <li>Synchronous transcription of an uploaded file
 *   <li>Asynchronous transcription (returns a job ID immediately) and job status polling
 * </ul>
 *
 * <p>Failures are turned into HTTP responses by {@link ApiExceptionHandler}.
 */
@RestController
@Tag(name = "Transcription", description = "Audio transcription through the Whisper backend")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final TranscriptionService transcriptionService;
  private final TranscriptionJobRunner jobRunner;
  private final JobRepository jobRepository;

  public TranscriptionController(
      TranscriptionService transcriptionService,
      TranscriptionJobRunner jobRunner,
      JobRepository jobRepository) {
    this.transcriptionService = transcriptionService;
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
  }

  @GetMapping("/api/models")
  @Operation(summary = "List models", description = "Models the backend offers and has loaded")
  public ModelsResult models() {
    String requestId = UUID.randomUUID().toString();
    try {
      StructuredLogger.setRequestContext(requestId);
      return transcriptionService.listModels();
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /** Transcribe an uploaded file and wait for the result. */
  @PostMapping(value = "/api/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Transcribe audio",
      description =
          "Upload an audio file and wait for its transcription. An empty language means "
              + "auto-detect; task is 'transcribe' or 'translate'.")
  public TranscriptionResult transcribe(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "model", required = false) String model,
      @RequestParam(value = "language", required = false) String language,
      @RequestParam(value = "task", defaultValue = "transcribe") String task) {
    String requestId = UUID.randomUUID().toString();
    try {
      StructuredLogger.setRequestContext(requestId);
      TranscriptionOptions options = toOptions(model, language, task);
      return transcriptionService.transcribe(readUpload(file), options);
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /** Start an asynchronous transcription job. */
  @PostMapping(value = "/api/jobs", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Start transcription job",
      description = "Upload an audio file and return a job ID for status polling")
  public ResponseEntity<AsyncJobResponse> submitJob(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "model", required = false) String model,
      @RequestParam(value = "language", required = false) String language,
      @RequestParam(value = "task", defaultValue = "transcribe") String task) {
    String jobId = UUID.randomUUID().toString();
    try {
      StructuredLogger.setJobContext(jobId);
      TranscriptionOptions options = toOptions(model, language, task);
      TranscriptionJob job = new TranscriptionJob(jobId, readUpload(file), options);
      jobRepository.save(job);

      LOGGER.info("Created async transcription job: {}", jobId);
      try {
        jobRunner.run(job);
      } catch (TaskRejectedException e) {
        jobRepository.discard(jobId);
        LOGGER.warn("Job queue is full, discarded job {}", jobId);
        throw e;
      }

      return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  /** Get job status; includes the transcription once the job is completed. */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a transcription job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(), job.getStatus(), job.getResult(), job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }

  private static TranscriptionOptions toOptions(String model, String language, String task) {
    return new TranscriptionOptions(model, language, WhisperTask.fromWireName(task));
  }

  private static AudioUpload readUpload(MultipartFile file) {
    if (file.isEmpty()) {
      throw new IllegalArgumentException("Uploaded file is empty");
    }
    try {
      return new AudioUpload(file.getOriginalFilename(), file.getBytes());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read uploaded file", e);
    }
  }
}
