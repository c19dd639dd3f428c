package com.scholary.whisper.gateway.transport;

import java.io.IOException;

/** Every dial attempt to the backend failed; no connection is held afterwards. */
public class ConnectionUnavailableException extends IOException {

  private final int attempts;

  public ConnectionUnavailableException(String message, int attempts, Throwable cause) {
    super(message, cause);
    this.attempts = attempts;
  }

  /** Number of dial attempts made before giving up. */
  public int getAttempts() {
    return attempts;
  }
}
