package com.scholary.whisper.gateway.whisper;

/** The backend could not be reached within the dial retry budget. No connection is held. */
public class WhisperConnectionException extends WhisperException {

  public WhisperConnectionException(String message) {
    super(FailureKind.CONNECTION, message);
  }

  public WhisperConnectionException(String message, Throwable cause) {
    super(FailureKind.CONNECTION, message, cause);
  }
}
