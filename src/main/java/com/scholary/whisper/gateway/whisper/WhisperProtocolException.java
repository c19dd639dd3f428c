package com.scholary.whisper.gateway.whisper;

/** A frame was truncated or oversized, or its JSON content could not be encoded or decoded. */
public class WhisperProtocolException extends WhisperException {

  public WhisperProtocolException(String message) {
    super(FailureKind.PROTOCOL, message);
  }

  public WhisperProtocolException(String message, Throwable cause) {
    super(FailureKind.PROTOCOL, message, cause);
  }
}
