package com.scholary.whisper.gateway.whisper;

/** A write or read failed mid-call. The connection has been torn down; the next call reconnects. */
public class WhisperTransportException extends WhisperException {

  public WhisperTransportException(String message) {
    super(FailureKind.IO, message);
  }

  public WhisperTransportException(String message, Throwable cause) {
    super(FailureKind.IO, message, cause);
  }
}
