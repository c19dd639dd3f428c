package com.scholary.whisper.gateway.service;

import com.scholary.whisper.gateway.config.GatewayProperties;
import com.scholary.whisper.gateway.config.GatewayProperties.UploadMode;
import com.scholary.whisper.gateway.whisper.MetricsSnapshot;
import com.scholary.whisper.gateway.whisper.ModelsResult;
import com.scholary.whisper.gateway.whisper.TranscriptionResult;
import com.scholary.whisper.gateway.whisper.WhisperService;
import com.scholary.whisper.gateway.whisper.WhisperTask;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hands uploaded audio to the Whisper backend.
 *
 * <p>In {@link UploadMode#BYTES} mode the audio goes inline with the request. In {@link
 * UploadMode#PATH} mode it is written to the shared temp directory first and only the path is
 * sent; the file is removed again once the call is over.
 */
@Service
public class TranscriptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionService.class);

  private final WhisperService whisperService;
  private final UploadMode uploadMode;
  private final String defaultModel;
  private final Path tempDir;

  public TranscriptionService(WhisperService whisperService, GatewayProperties properties) {
    this.whisperService = whisperService;
    this.uploadMode = properties.uploadMode();
    this.defaultModel = properties.defaultModel();
    this.tempDir = Paths.get(properties.tempDir());

    if (uploadMode == UploadMode.PATH) {
      try {
        Files.createDirectories(this.tempDir);
      } catch (IOException e) {
        throw new RuntimeException("Failed to create temp directory: " + tempDir, e);
      }
    }
    LOGGER.info(
        "Transcription service ready: uploadMode={}, defaultModel={}", uploadMode, defaultModel);
  }

  /**
   * Transcribe an upload.
   *
   * <p>The returned {@code processing_time} is the gateway's own wall-clock time for the call, in
   * seconds, not the backend's figure.
   */
  public TranscriptionResult transcribe(AudioUpload upload, TranscriptionOptions options) {
    String model = resolveModel(options.model());
    WhisperTask task = options.task() == null ? WhisperTask.TRANSCRIBE : options.task();

    LOGGER.info(
        "Transcription request: file={}, size={} bytes, model={}, mode={}",
        upload.filename(),
        upload.size(),
        model,
        uploadMode);

    long startNanos = System.nanoTime();
    TranscriptionResult result =
        uploadMode == UploadMode.PATH
            ? transcribeViaFile(upload, model, options.language(), task)
            : whisperService.transcribeByBytes(upload.data(), model, options.language(), task);
    double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;

    LOGGER.info(
        "Transcription finished: file={}, language={}, segments={}, {}s",
        upload.filename(),
        result.language(),
        result.segments().size(),
        String.format("%.2f", elapsedSeconds));
    return result.withProcessingTime(elapsedSeconds);
  }

  public ModelsResult listModels() {
    return whisperService.listModels();
  }

  public MetricsSnapshot backendMetrics() {
    return whisperService.metricsSnapshot();
  }

  private TranscriptionResult transcribeViaFile(
      AudioUpload upload, String model, String language, WhisperTask task) {
    Path audioFile = storeUpload(upload);
    try {
      return whisperService.transcribeByPath(audioFile, model, language, task);
    } finally {
      try {
        Files.deleteIfExists(audioFile);
      } catch (IOException e) {
        LOGGER.warn("Failed to delete temp upload {}: {}", audioFile, e.getMessage());
      }
    }
  }

  private Path storeUpload(AudioUpload upload) {
    try {
      Path audioFile = Files.createTempFile(tempDir, "upload-", upload.extension());
      Files.write(audioFile, upload.data());
      LOGGER.debug("Stored upload {} at {}", upload.filename(), audioFile);
      return audioFile;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to store upload in " + tempDir, e);
    }
  }

  private String resolveModel(String model) {
    return model == null || model.isBlank() ? defaultModel : model.trim();
  }
}
