package com.scholary.whisper.gateway.whisper;

/** A decoded backend response. Any response may carry an {@code error} instead of a result. */
public interface WhisperReply {

  String error();

  /** A non-empty error marks the whole call as failed. */
  default boolean hasError() {
    String error = error();
    return error != null && !error.isEmpty();
  }
}
