package com.scholary.whisper.gateway.whisper;

/**
 * A message sent to the backend. The {@code command} field tells the backend which variant it is.
 */
public interface WhisperRequest {

  String COMMAND_TRANSCRIBE = "transcribe";
  String COMMAND_LIST_MODELS = "list_models";

  String command();
}
