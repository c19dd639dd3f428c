package com.scholary.whisper.gateway.whisper;

import java.nio.file.Path;

/**
 * Calls into the Whisper transcription backend.
 *
 * <p>This abstraction is all the gateway sees of the backend; the connection and the wire format
 * stay behind it. Every failure is a {@link WhisperException}.
 */
public interface WhisperService extends AutoCloseable {

  /**
   * Transcribe a file that the backend can read from the filesystem it shares with the gateway.
   *
   * @param audioFile the audio file; resolved to an absolute real path before sending
   * @param model the model name, for example {@code base}
   * @param language language code, or null/empty to let the backend detect it
   * @param task transcribe or translate
   * @return the transcription
   * @throws InvalidAudioPathException if the file cannot be resolved, before any network I/O
   * @throws WhisperException if the call fails
   */
  TranscriptionResult transcribeByPath(
      Path audioFile, String model, String language, WhisperTask task);

  /**
   * Transcribe audio sent along with the request.
   *
   * @param audio the raw audio bytes, any container format the backend understands
   * @param model the model name
   * @param language language code, or null/empty to let the backend detect it
   * @param task transcribe or translate
   * @return the transcription
   * @throws WhisperException if the call fails
   */
  TranscriptionResult transcribeByBytes(
      byte[] audio, String model, String language, WhisperTask task);

  /**
   * List the models the backend offers and the ones it has loaded.
   *
   * @throws WhisperException if the call fails
   */
  ModelsResult listModels();

  /** Current call counters. */
  MetricsSnapshot metricsSnapshot();

  /** Drop the backend connection and release resources. Idempotent. */
  @Override
  void close();
}
