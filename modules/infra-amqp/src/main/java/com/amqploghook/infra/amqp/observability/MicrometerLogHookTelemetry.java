package com.amqploghook.infra.amqp.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

// Both outcomes register the publish counter with the same tag keys.
public class MicrometerLogHookTelemetry implements LogHookTelemetry {
  private static final String NONE = "none";

  private final MeterRegistry meterRegistry;

  public MicrometerLogHookTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onPublishSuccess(String exchange, String routingKey, String level, long durationNanos) {
    Counter.builder("infra.amqp.loghook.publish.total")
        .description("Total log entries forwarded to AMQP by outcome")
        .tag("exchange", safeValue(exchange))
        .tag("level", safeValue(level))
        .tag("outcome", "success")
        .tag("stage", NONE)
        .tag("error", NONE)
        .register(meterRegistry)
        .increment();

    Timer.builder("infra.amqp.loghook.publish.duration")
        .description("Connect, declare and publish latency of one log entry")
        .tag("exchange", safeValue(exchange))
        .tag("level", safeValue(level))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(
      String exchange, String routingKey, String level, String stage, Throwable error) {
    Counter.builder("infra.amqp.loghook.publish.total")
        .description("Total log entries forwarded to AMQP by outcome")
        .tag("exchange", safeValue(exchange))
        .tag("level", safeValue(level))
        .tag("outcome", "failure")
        .tag("stage", safeValue(stage))
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  // The hook wraps collaborator failures, so the root cause names the error.
  private static String safeError(Throwable error) {
    if (error == null) {
      return NONE;
    }
    Throwable cause = error.getCause() != null ? error.getCause() : error;
    return cause.getClass().getSimpleName();
  }
}
