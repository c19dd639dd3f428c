package com.scholary.whisper.gateway.whisper;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Point-in-time copy of the client's counters. All values are cumulative since start-up. */
public record MetricsSnapshot(
    @JsonProperty("requests_total") long requestsTotal,
    @JsonProperty("errors_total") long errorsTotal,
    @JsonProperty("processing_time_ms") long processingTimeMs) {}
