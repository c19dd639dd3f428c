package com.scholary.whisper.gateway.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the HTTP gateway.
 *
 * <p>Controls how uploads reach the backend, request defaults and the async job pool.
 */
@ConfigurationProperties(prefix = "gateway")
@Validated
public record GatewayProperties(
    @NotNull UploadMode uploadMode,
    @NotBlank String tempDir,
    @NotBlank String defaultModel,
    @NotBlank String version,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  /** How an uploaded file is handed to the backend. */
  public enum UploadMode {
    /** Send the audio inline, base64-encoded. */
    BYTES,
    /** Save the audio under {@code tempDir} and send its path; the backend must see that disk. */
    PATH
  }
}
