package com.scholary.whisper.gateway.whisper;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Transcribe a file the backend reads from a filesystem it shares with the gateway.
 *
 * <p>{@code language} is omitted from the JSON when null, which makes the backend auto-detect.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"command", "audio_path", "model", "language", "task"})
public record FileTranscriptionRequest(
    @JsonProperty("command") String command,
    @JsonProperty("audio_path") String audioPath,
    @JsonProperty("model") String model,
    @JsonProperty("language") String language,
    @JsonProperty("task") WhisperTask task)
    implements WhisperRequest {

  public static FileTranscriptionRequest of(
      String absolutePath, String model, String language, WhisperTask task) {
    return new FileTranscriptionRequest(COMMAND_TRANSCRIBE, absolutePath, model, language, task);
  }
}
