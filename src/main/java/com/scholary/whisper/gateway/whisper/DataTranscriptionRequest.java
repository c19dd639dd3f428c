package com.scholary.whisper.gateway.whisper;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Base64;

/**
 * Transcribe audio sent inline. The bytes travel base64-encoded so they survive the JSON payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"command", "audio_data", "model", "language", "task"})
public record DataTranscriptionRequest(
    @JsonProperty("command") String command,
    @JsonProperty("audio_data") String audioData,
    @JsonProperty("model") String model,
    @JsonProperty("language") String language,
    @JsonProperty("task") WhisperTask task)
    implements WhisperRequest {

  public static DataTranscriptionRequest of(
      byte[] audio, String model, String language, WhisperTask task) {
    return new DataTranscriptionRequest(
        COMMAND_TRANSCRIBE, Base64.getEncoder().encodeToString(audio), model, language, task);
  }
}
