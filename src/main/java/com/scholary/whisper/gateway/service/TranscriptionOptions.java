package com.scholary.whisper.gateway.service;

import com.scholary.whisper.gateway.whisper.WhisperTask;

/** Per-request transcription parameters taken from the upload form. */
public record TranscriptionOptions(String model, String language, WhisperTask task) {}
