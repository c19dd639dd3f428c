package com.scholary.whisper.gateway.whisper;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper backend client.
 *
 * <p>Where the backend lives, how long a dial and a call may take, and how often to retry the
 * dial. Host and port can come from {@code WHISPER_HOST} / {@code WHISPER_PORT}.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String host,
    @Min(1) @Max(65535) int port,
    @Positive int connectTimeoutMs,
    @Positive long ioTimeoutMs,
    @Positive int maxConnectAttempts,
    @PositiveOrZero long retryBackoffMs,
    @Positive long maxFrameBytes) {}
