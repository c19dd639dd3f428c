package com.scholary.whisper.gateway.api;

/** Error body returned by every endpoint: {@code {"error": "..."}}. */
public record ErrorResponse(String error) {}
