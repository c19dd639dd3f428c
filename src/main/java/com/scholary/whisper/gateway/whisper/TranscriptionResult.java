package com.scholary.whisper.gateway.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of a transcription call.
 *
 * <p>The same shape is returned to HTTP clients, so the JSON names stay the backend's.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptionResult(
    @JsonProperty("text") String text,
    @JsonProperty("language") String language,
    @JsonProperty("segments") List<TranscriptSegment> segments,
    @JsonProperty("processing_time") double processingTime,
    @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_EMPTY) String error)
    implements WhisperReply {

  public TranscriptionResult {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  /** Copy with a different processing time, in seconds. */
  public TranscriptionResult withProcessingTime(double seconds) {
    return new TranscriptionResult(text, language, segments, seconds, error);
  }
}
