package com.scholary.whisper.gateway.transport;

import com.scholary.whisper.gateway.logging.StructuredLogger;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the one persistent connection to the Whisper backend.
 *
 * <p>The connection is either absent or open. It is dialled lazily by {@link #ensureConnection()}
 * and dropped by {@link #closeConnection(String)} as soon as any read or write on it fails; the
 * next call then dials again from scratch.
 *
 * <p>Not thread-safe on its own. Every method must be called while holding the {@link
 * ExclusiveAccessGate} that guards this connection.
 */
public class BackendConnection {

  private static final Logger LOGGER = LoggerFactory.getLogger(BackendConnection.class);
  private static final int IDLE_PROBE_TIMEOUT_MS = 1;

  private final String host;
  private final int port;
  private final int connectTimeoutMs;
  private final int maxAttempts;
  private final long retryBackoffMs;
  private final SocketConnector connector;
  private final StructuredLogger events;

  private Socket socket;

  public BackendConnection(
      String host,
      int port,
      int connectTimeoutMs,
      int maxAttempts,
      long retryBackoffMs,
      SocketConnector connector) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.host = host;
    this.port = port;
    this.connectTimeoutMs = connectTimeoutMs;
    this.maxAttempts = maxAttempts;
    this.retryBackoffMs = retryBackoffMs;
    this.connector = connector;
    this.events = new StructuredLogger(LOGGER);
  }

  /**
   * Make sure a connection is open, dialling if necessary.
   *
   * <p>Returns the held connection when it is still usable; one the backend closed while idle is
   * dropped first. Otherwise dials up to {@code maxAttempts} times, each attempt bounded by the
   * connect timeout, sleeping the fixed backoff between attempts. An interrupt does not shorten
   * the dial loop; the thread's interrupt flag is set again when this method returns or throws.
   *
   * @return the open socket
   * @throws ConnectionUnavailableException if every attempt failed
   */
  public Socket ensureConnection() throws ConnectionUnavailableException {
    if (socket != null) {
      if (isReusable(socket)) {
        return socket;
      }
      closeConnection("closed by backend while idle");
    }

    IOException lastFailure = null;
    boolean interrupted = false;
    try {
      for (int attempt = 1; attempt <= maxAttempts; attempt++) {
        try {
          socket = connector.connect(new InetSocketAddress(host, port), connectTimeoutMs);
          events.logConnectionOpened(host, port, attempt);
          return socket;
        } catch (IOException e) {
          lastFailure = e;
          if (attempt < maxAttempts) {
            events.logConnectRetry(
                host, port, attempt, maxAttempts, retryBackoffMs, e.getMessage());
            interrupted |= sleepUninterruptibly(retryBackoffMs);
          }
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    String message = lastFailure == null ? "unknown" : lastFailure.getMessage();
    events.logConnectFailed(host, port, maxAttempts, message);
    throw new ConnectionUnavailableException(
        String.format(
            "Could not connect to Whisper backend %s:%d after %d attempts",
            host, port, maxAttempts),
        maxAttempts,
        lastFailure);
  }

  /**
   * Sleep the full backoff even if the thread is interrupted. A call that already started keeps
   * its whole dial budget; the interrupt is handed back to the caller afterwards.
   *
   * @return whether an interrupt arrived before or during the sleep
   */
  private static boolean sleepUninterruptibly(long millis) {
    boolean interrupted = Thread.interrupted();
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    while (true) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return interrupted;
      }
      try {
        TimeUnit.NANOSECONDS.sleep(remaining);
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
  }

  /**
   * Close the connection if one is open. Safe to call repeatedly and from any failure path.
   *
   * @param reason short description for the log
   */
  public void closeConnection(String reason) {
    if (socket == null) {
      return;
    }
    Socket closing = socket;
    socket = null;
    try {
      closing.close();
    } catch (IOException e) {
      LOGGER.debug("Ignoring error while closing backend socket: {}", e.getMessage());
    }
    events.logConnectionClosed(host, port, reason);
  }

  /**
   * Check an idle socket before reusing it. Between calls the backend never sends anything, so a
   * short read either times out (still healthy), returns end-of-stream (peer closed) or returns a
   * stray byte (stream out of sync). Only the first case is reusable.
   */
  private boolean isReusable(Socket idle) {
    if (idle.isClosed() || idle.isInputShutdown()) {
      return false;
    }
    try {
      idle.setSoTimeout(IDLE_PROBE_TIMEOUT_MS);
      try {
        int read = idle.getInputStream().read();
        if (read >= 0) {
          LOGGER.warn("Unexpected data on idle connection to {}, reconnecting", describe());
        }
        return false;
      } finally {
        idle.setSoTimeout(0);
      }
    } catch (SocketTimeoutException e) {
      return true;
    } catch (IOException e) {
      LOGGER.debug("Idle connection to {} is unusable: {}", describe(), e.getMessage());
      return false;
    }
  }

  public boolean isOpen() {
    return socket != null;
  }

  /** The open socket's input stream. Only valid after {@link #ensureConnection()}. */
  public InputStream input() throws IOException {
    return requireSocket().getInputStream();
  }

  /** The open socket's output stream. Only valid after {@link #ensureConnection()}. */
  public OutputStream output() throws IOException {
    return requireSocket().getOutputStream();
  }

  public String describe() {
    return host + ":" + port;
  }

  private Socket requireSocket() {
    if (socket == null) {
      throw new IllegalStateException("No open connection to " + describe());
    }
    return socket;
  }
}
