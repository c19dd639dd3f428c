package com.scholary.whisper.gateway.api;

/** Response for async job creation. Poll {@code /api/jobs/{jobId}} for the outcome. */
public record AsyncJobResponse(String jobId) {}
