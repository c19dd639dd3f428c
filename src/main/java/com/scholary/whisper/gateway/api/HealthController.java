package com.scholary.whisper.gateway.api;

import com.scholary.whisper.gateway.config.GatewayProperties;
import com.scholary.whisper.gateway.service.TranscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Instant;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health endpoint.
 *
 * <p>Reports the gateway as up without touching the backend, so a slow transcription never makes
 * the gateway look dead.
 */
@RestController
@Tag(name = "Health", description = "Gateway status")
public class HealthController {

  private final TranscriptionService transcriptionService;
  private final String version;

  public HealthController(
      TranscriptionService transcriptionService, GatewayProperties gatewayProperties) {
    this.transcriptionService = transcriptionService;
    this.version = gatewayProperties.version();
  }

  @GetMapping("/api/health")
  @Operation(summary = "Gateway health", description = "Status, server time, version and counters")
  public HealthResponse health() {
    return new HealthResponse(
        "ok", Instant.now(), version, transcriptionService.backendMetrics());
  }
}
