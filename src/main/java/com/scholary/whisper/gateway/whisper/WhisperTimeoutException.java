package com.scholary.whisper.gateway.whisper;

/** The I/O deadline elapsed during the call. The connection has been torn down. */
public class WhisperTimeoutException extends WhisperException {

  public WhisperTimeoutException(String message) {
    super(FailureKind.TIMEOUT, message);
  }

  public WhisperTimeoutException(String message, Throwable cause) {
    super(FailureKind.TIMEOUT, message, cause);
  }
}
