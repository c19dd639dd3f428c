package com.scholary.whisper.gateway.whisper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.whisper.gateway.logging.StructuredLogger;
import com.scholary.whisper.gateway.transport.BackendConnection;
import com.scholary.whisper.gateway.transport.ConnectionUnavailableException;
import com.scholary.whisper.gateway.transport.ExclusiveAccessGate;
import com.scholary.whisper.gateway.transport.FrameCodec;
import com.scholary.whisper.gateway.transport.IoDeadlineWatchdog;
import com.scholary.whisper.gateway.transport.SocketConnector;
import java.io.IOException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the Whisper backend's framed TCP protocol.
 *
 * <p>Every call follows the same template: normalize the inputs, build the typed request, take the
 * connection gate, make sure a connection is open, write the request frame and read the response
 * frame under one I/O deadline, leave the gate, then decode the response. A response with a
 * non-empty {@code error} field fails the call even though the round trip worked.
 *
 * <p>One instance owns one connection. Concurrent callers are fine, but they take turns on the
 * wire: a call holds the connection from the first byte written until its response has been read.
 * Nothing is retried except the dial inside {@link BackendConnection#ensureConnection()}.
 *
 * <p>Cancellation: an interrupted caller is turned away before it starts waiting for the gate.
 * Once it waits or talks to the backend, the call runs to completion, to the I/O deadline or to an
 * I/O error.
 */
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final ObjectMapper objectMapper;
  private final FrameCodec codec;
  private final BackendConnection connection;
  private final ExclusiveAccessGate gate = new ExclusiveAccessGate();
  private final IoDeadlineWatchdog watchdog = new IoDeadlineWatchdog();
  private final ClientMetrics metrics = new ClientMetrics();
  private final StructuredLogger events = new StructuredLogger(LOGGER);
  private final long ioTimeoutMs;

  private volatile boolean closed;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this(properties, objectMapper, SocketConnector.plain());
  }

  public WhisperClient(
      WhisperProperties properties, ObjectMapper objectMapper, SocketConnector connector) {
    this.objectMapper = objectMapper;
    this.codec = new FrameCodec(properties.maxFrameBytes());
    this.ioTimeoutMs = properties.ioTimeoutMs();
    this.connection =
        new BackendConnection(
            properties.host(),
            properties.port(),
            properties.connectTimeoutMs(),
            properties.maxConnectAttempts(),
            properties.retryBackoffMs(),
            connector);

    LOGGER.info(
        "Initialized Whisper client: backend={}:{}, connectTimeout={}ms, ioTimeout={}ms",
        properties.host(),
        properties.port(),
        properties.connectTimeoutMs(),
        properties.ioTimeoutMs());
  }

  @Override
  public TranscriptionResult transcribeByPath(
      Path audioFile, String model, String language, WhisperTask task) {
    Path resolved = resolveAudioFile(audioFile);
    FileTranscriptionRequest request =
        FileTranscriptionRequest.of(
            resolved.toString(),
            requireModel(model),
            normalizeLanguage(language),
            requireTask(task));

    LOGGER.info(
        "Transcribing file: path={}, model={}, language={}, task={}",
        resolved,
        request.model(),
        request.language(),
        request.task().wireName());
    return call(request, TranscriptionResult.class);
  }

  @Override
  public TranscriptionResult transcribeByBytes(
      byte[] audio, String model, String language, WhisperTask task) {
    if (audio == null) {
      throw new IllegalArgumentException("audio must not be null");
    }
    DataTranscriptionRequest request =
        DataTranscriptionRequest.of(
            audio, requireModel(model), normalizeLanguage(language), requireTask(task));

    LOGGER.info(
        "Transcribing audio data: bytes={}, model={}, language={}, task={}",
        audio.length,
        request.model(),
        request.language(),
        request.task().wireName());
    return call(request, TranscriptionResult.class);
  }

  @Override
  public ModelsResult listModels() {
    return call(new ListModelsRequest(), ModelsResult.class);
  }

  @Override
  public MetricsSnapshot metricsSnapshot() {
    return metrics.snapshot();
  }

  /** Live counters, for exporting to a meter registry. */
  public ClientMetrics metrics() {
    return metrics;
  }

  /**
   * Close the connection and stop the deadline watchdog.
   *
   * <p>Waits for an in-flight call to finish first. Later calls fail with {@link
   * WhisperConnectionException}.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      gate.runExclusively(
          () -> {
            connection.closeConnection("client closed");
            return null;
          });
    } catch (IOException e) {
      LOGGER.warn("Error while closing Whisper client: {}", e.getMessage());
    } finally {
      watchdog.close();
    }
    LOGGER.info("Whisper client closed: {}", metrics.snapshot());
  }

  /**
   * Run one logical call and keep the counters.
   *
   * <p>Counts one request per call that gets this far, one error per failed call regardless of
   * where or how it failed, and the call's wall-clock time.
   */
  private <R extends WhisperReply> R call(WhisperRequest request, Class<R> replyType) {
    String command = request.command();
    if (Thread.currentThread().isInterrupted()) {
      throw new WhisperCallCancelledException(
          "Call '" + command + "' cancelled before it was sent");
    }

    long startNanos = System.nanoTime();
    metrics.recordRequest();
    try {
      byte[] responsePayload = roundTrip(encode(request));
      R reply = decode(responsePayload, replyType);
      if (reply.hasError()) {
        throw new WhisperApplicationException(reply.error());
      }
      events.logCallFinished(command, elapsedMs(startNanos));
      return reply;
    } catch (RuntimeException e) {
      metrics.recordError();
      String errorType =
          e instanceof WhisperException
              ? ((WhisperException) e).kind().name()
              : e.getClass().getSimpleName();
      events.logCallFailed(command, elapsedMs(startNanos), errorType, e.getMessage());
      throw e;
    } finally {
      metrics.recordProcessingTime(elapsedMs(startNanos));
    }
  }

  private byte[] roundTrip(byte[] requestPayload) {
    try {
      return gate.runExclusively(() -> exchange(requestPayload));
    } catch (ConnectionUnavailableException e) {
      throw new WhisperConnectionException(e.getMessage(), e);
    } catch (IOException e) {
      throw new WhisperTransportException("Backend call failed: " + e.getMessage(), e);
    }
  }

  /** Write one request frame and read its response frame. Runs under the gate. */
  private byte[] exchange(byte[] requestPayload) throws IOException {
    if (closed) {
      throw new ConnectionUnavailableException("Whisper client is closed", 0, null);
    }
    Socket socket = connection.ensureConnection();
    IoDeadlineWatchdog.Deadline deadline = watchdog.arm(socket, ioTimeoutMs);
    try {
      codec.writeFrame(connection.output(), requestPayload);
      byte[] responsePayload = codec.decode(connection.input());
      if (!deadline.disarm()) {
        // The response made it, but the watchdog has closed the socket underneath us.
        connection.closeConnection("deadline elapsed after response");
      }
      return responsePayload;
    } catch (IOException e) {
      boolean timedOut = !deadline.disarm() || e instanceof SocketTimeoutException;
      connection.closeConnection(timedOut ? "i/o deadline elapsed" : "i/o failure");
      throw classify(e, timedOut);
    }
  }

  private WhisperException classify(IOException e, boolean timedOut) {
    if (timedOut) {
      return new WhisperTimeoutException(
          String.format("No response from backend within %dms", ioTimeoutMs), e);
    }
    if (e instanceof FrameCodec.TruncatedFrameException
        && ((FrameCodec.TruncatedFrameException) e).isNothingRead()) {
      return new WhisperTransportException(
          "Backend " + connection.describe() + " closed the connection without answering", e);
    }
    if (e instanceof FrameCodec.TruncatedFrameException
        || e instanceof FrameCodec.FrameTooLargeException) {
      return new WhisperProtocolException("Invalid response frame: " + e.getMessage(), e);
    }
    return new WhisperTransportException(
        String.format("I/O error talking to %s: %s", connection.describe(), e.getMessage()), e);
  }

  private byte[] encode(WhisperRequest request) {
    try {
      byte[] payload = objectMapper.writeValueAsBytes(request);
      FrameCodec.checkEncodable(payload.length);
      return payload;
    } catch (JsonProcessingException e) {
      throw new WhisperProtocolException("Could not encode request: " + e.getOriginalMessage(), e);
    } catch (FrameCodec.FrameTooLargeException e) {
      throw new WhisperProtocolException("Request too large: " + e.getMessage(), e);
    }
  }

  private <R> R decode(byte[] payload, Class<R> replyType) {
    try {
      R reply = objectMapper.readValue(payload, replyType);
      if (reply == null) {
        throw new WhisperProtocolException("Backend sent an empty response");
      }
      return reply;
    } catch (IOException e) {
      throw new WhisperProtocolException("Could not decode response: " + e.getMessage(), e);
    }
  }

  /**
   * Resolve to an absolute path without symlinks. The backend opens the file itself, so it must
   * exist and be readable from here too.
   */
  static Path resolveAudioFile(Path audioFile) {
    if (audioFile == null) {
      throw new InvalidAudioPathException("Audio path must not be null");
    }
    Path resolved;
    try {
      resolved = audioFile.toAbsolutePath().toRealPath();
    } catch (IOException | SecurityException e) {
      throw new InvalidAudioPathException("Audio file does not exist: " + audioFile, e);
    }
    if (!Files.isRegularFile(resolved) || !Files.isReadable(resolved)) {
      throw new InvalidAudioPathException("Audio file is not a readable file: " + resolved);
    }
    return resolved;
  }

  /** Empty means "not specified": the field is left out and the backend detects the language. */
  static String normalizeLanguage(String language) {
    if (language == null || language.isBlank()) {
      return null;
    }
    return language.trim();
  }

  private static String requireModel(String model) {
    if (model == null || model.isBlank()) {
      throw new IllegalArgumentException("model must not be blank");
    }
    return model.trim();
  }

  private static WhisperTask requireTask(WhisperTask task) {
    if (task == null) {
      throw new IllegalArgumentException("task must not be null");
    }
    return task;
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
