package com.scholary.whisper.gateway.whisper;

/** Classification of a failed Whisper call, used for logs, metrics tags and HTTP mapping. */
public enum FailureKind {
  /** The dial retry budget ran out. */
  CONNECTION,
  /** A read or write failed on an established connection. */
  IO,
  /** The I/O deadline elapsed while writing or reading. */
  TIMEOUT,
  /** The frame or its JSON content could not be encoded or decoded. */
  PROTOCOL,
  /** The backend answered with a non-empty {@code error} field. */
  APPLICATION,
  /** The call was rejected before it reached the backend. */
  INVALID_REQUEST,
  /** The caller was interrupted before the call started. */
  CANCELLED
}
