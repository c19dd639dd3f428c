package com.scholary.whisper.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.whisper.gateway.whisper.MetricsSnapshot;
import java.time.Instant;

/** Liveness of the gateway itself plus the backend client's counters. */
public record HealthResponse(
    String status,
    @JsonProperty("server_time") Instant serverTime,
    String version,
    MetricsSnapshot backend) {}
