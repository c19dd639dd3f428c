package com.scholary.whisper.gateway.whisper;

/** The audio path of a by-path call does not resolve to a readable file. Raised before any I/O. */
public class InvalidAudioPathException extends WhisperException {

  public InvalidAudioPathException(String message) {
    super(FailureKind.INVALID_REQUEST, message);
  }

  public InvalidAudioPathException(String message, Throwable cause) {
    super(FailureKind.INVALID_REQUEST, message, cause);
  }
}
