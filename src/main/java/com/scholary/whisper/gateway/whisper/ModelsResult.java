package com.scholary.whisper.gateway.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** Models the backend can load (name to description) and the ones it has loaded already. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelsResult(
    @JsonProperty("available_models") Map<String, String> availableModels,
    @JsonProperty("loaded_models") Set<String> loadedModels,
    @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_EMPTY) String error)
    implements WhisperReply {

  public ModelsResult {
    availableModels =
        availableModels == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(availableModels));
    loadedModels =
        loadedModels == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(loadedModels));
  }
}
