package com.scholary.whisper.gateway.whisper;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Ask the backend which models it offers and which are already loaded. */
public record ListModelsRequest(@JsonProperty("command") String command)
    implements WhisperRequest {

  public ListModelsRequest() {
    this(COMMAND_LIST_MODELS);
  }
}
