package com.scholary.whisper.gateway.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Represents a single segment of transcribed audio.
 *
 * <p>The backend sends more per segment (token ids, log probabilities and so on); only timing and
 * text are kept.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(String text, double start, double end) {}
