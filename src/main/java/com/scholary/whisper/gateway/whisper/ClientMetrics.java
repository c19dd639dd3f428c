package com.scholary.whisper.gateway.whisper;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Call counters of one {@link WhisperClient}.
 *
 * <p>Updated from many threads without holding the connection gate, hence atomics. Counters only
 * grow; there is no reset and no windowing.
 */
public class ClientMetrics {

  private final AtomicLong requestsTotal = new AtomicLong();
  private final AtomicLong errorsTotal = new AtomicLong();
  private final AtomicLong processingTimeMs = new AtomicLong();

  void recordRequest() {
    requestsTotal.incrementAndGet();
  }

  void recordError() {
    errorsTotal.incrementAndGet();
  }

  void recordProcessingTime(long millis) {
    processingTimeMs.addAndGet(millis);
  }

  public long requestsTotal() {
    return requestsTotal.get();
  }

  public long errorsTotal() {
    return errorsTotal.get();
  }

  public long processingTimeMs() {
    return processingTimeMs.get();
  }

  public MetricsSnapshot snapshot() {
    return new MetricsSnapshot(requestsTotal.get(), errorsTotal.get(), processingTimeMs.get());
  }
}
