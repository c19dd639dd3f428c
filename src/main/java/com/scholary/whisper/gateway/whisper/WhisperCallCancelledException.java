package com.scholary.whisper.gateway.whisper;

/** The calling thread was interrupted before the call started waiting for the connection. */
public class WhisperCallCancelledException extends WhisperException {

  public WhisperCallCancelledException(String message) {
    super(FailureKind.CANCELLED, message);
  }

  public WhisperCallCancelledException(String message, Throwable cause) {
    super(FailureKind.CANCELLED, message, cause);
  }
}
