package com.scholary.whisper.gateway.whisper;

/**
 * The backend answered, but the answer carries an error message.
 *
 * <p>The transport round trip succeeded and the connection stays usable.
 */
public class WhisperApplicationException extends WhisperException {

  public WhisperApplicationException(String backendError) {
    super(FailureKind.APPLICATION, backendError);
  }
}
