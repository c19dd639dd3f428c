package com.scholary.whisper.gateway.whisper;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** What the backend should do with the audio. */
public enum WhisperTask {
  TRANSCRIBE("transcribe"),
  TRANSLATE("translate");

  private final String wireName;

  WhisperTask(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * Parse a task name as sent by HTTP clients.
   *
   * @throws IllegalArgumentException for anything but {@code transcribe} or {@code translate}
   */
  public static WhisperTask fromWireName(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (WhisperTask task : values()) {
        if (task.wireName.equals(normalized)) {
          return task;
        }
      }
    }
    throw new IllegalArgumentException(
        "Unsupported task '" + value + "', expected 'transcribe' or 'translate'");
  }
}
