package com.scholary.whisper.gateway.whisper;

/**
 * Exception thrown when Whisper backend calls fail.
 *
 * <p>Unchecked, like the rest of the client's failures: callers either translate it (the REST
 * layer) or let it fail the job. Subclasses name the failure; {@link #kind()} gives the same
 * information as a value.
 */
public class WhisperException extends RuntimeException {

  private final FailureKind kind;

  public WhisperException(FailureKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public WhisperException(FailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public FailureKind kind() {
    return kind;
  }
}
