package com.scholary.whisper.gateway.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts the event's fields into the MDC, logs one line and removes the fields again,
 * so the fields end up as queryable attributes in the log pipeline without leaking into unrelated
 * log lines of the same thread.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a failed dial attempt that will be retried. */
  public void logConnectRetry(
      String host, int port, int attempt, int maxAttempts, long backoffMs, String message) {
    try {
      MDC.put("event_type", "connect_retry");
      MDC.put("backend", host + ":" + port);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("backoffMs", String.valueOf(backoffMs));

      logger.warn(
          "Connect attempt {}/{} to {}:{} failed, retrying in {}ms: {}",
          attempt,
          maxAttempts,
          host,
          port,
          backoffMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log that the dial budget is exhausted. */
  public void logConnectFailed(String host, int port, int maxAttempts, String message) {
    try {
      MDC.put("event_type", "connect_failed");
      MDC.put("backend", host + ":" + port);
      MDC.put("maxAttempts", String.valueOf(maxAttempts));

      logger.error(
          "Could not connect to {}:{} after {} attempts: {}", host, port, maxAttempts, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a freshly opened backend connection. */
  public void logConnectionOpened(String host, int port, int attempt) {
    try {
      MDC.put("event_type", "connection_opened");
      MDC.put("backend", host + ":" + port);
      MDC.put("attempt", String.valueOf(attempt));

      logger.info("Connected to Whisper backend {}:{} (attempt {})", host, port, attempt);
    } finally {
      clearEventFields();
    }
  }

  /** Log a connection teardown. */
  public void logConnectionClosed(String host, int port, String reason) {
    try {
      MDC.put("event_type", "connection_closed");
      MDC.put("backend", host + ":" + port);

      logger.info("Closed connection to Whisper backend {}:{} ({})", host, port, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a completed backend call. */
  public void logCallFinished(String command, long durationMs) {
    try {
      MDC.put("event_type", "call_finished");
      MDC.put("command", command);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info("Request succeeded: command={}, duration={}ms", command, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed backend call. */
  public void logCallFailed(String command, long durationMs, String errorType, String message) {
    try {
      MDC.put("event_type", "call_failed");
      MDC.put("command", command);
      MDC.put("durationMs", String.valueOf(durationMs));
      MDC.put("errorType", errorType);

      logger.warn(
          "Request failed: command={}, duration={}ms, error={}, message={}",
          command,
          durationMs,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log an async job state change. */
  public void logJobStatus(String jobId, String status, String detail) {
    try {
      MDC.put("event_type", "job_status");
      MDC.put("status", status);

      logger.info("Job {}: status={} {}", jobId, status, detail);
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String requestId) {
    MDC.put("requestId", requestId);
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove("requestId");
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("backend");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("backoffMs");
    MDC.remove("command");
    MDC.remove("durationMs");
    MDC.remove("errorType");
    MDC.remove("status");
  }
}
