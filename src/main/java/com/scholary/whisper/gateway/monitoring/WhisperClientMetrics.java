package com.scholary.whisper.gateway.monitoring;

import com.scholary.whisper.gateway.whisper.ClientMetrics;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Publishes the Whisper client's counters to Micrometer.
 *
 * <p>The client keeps its own atomic counters; these meters only read them, so the numbers in
 * {@code /actuator/metrics} and in {@code /api/health} always agree.
 */
public class WhisperClientMetrics implements MeterBinder {

  private static final String METRIC_PREFIX = "whisper.client";

  private final ClientMetrics metrics;

  public WhisperClientMetrics(ClientMetrics metrics) {
    this.metrics = metrics;
  }

  @Override
  public void bindTo(MeterRegistry registry) {
    FunctionCounter.builder(METRIC_PREFIX + ".requests", metrics, ClientMetrics::requestsTotal)
        .description("Calls made to the Whisper backend")
        .register(registry);

    FunctionCounter.builder(METRIC_PREFIX + ".errors", metrics, ClientMetrics::errorsTotal)
        .description("Calls to the Whisper backend that failed")
        .register(registry);

    FunctionCounter.builder(
            METRIC_PREFIX + ".processing.time", metrics, ClientMetrics::processingTimeMs)
        .description("Cumulative wall-clock time spent in Whisper backend calls")
        .baseUnit("milliseconds")
        .register(registry);
  }
}
