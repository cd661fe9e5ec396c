package com.amqploghook.infra.amqp.observability;

public class NoOpLogHookTelemetry implements LogHookTelemetry {
  @Override
  public void onPublishSuccess(String exchange, String routingKey, String level, long durationNanos) {
  }

  @Override
  public void onPublishFailure(
      String exchange, String routingKey, String level, String stage, Throwable error) {
  }
}
