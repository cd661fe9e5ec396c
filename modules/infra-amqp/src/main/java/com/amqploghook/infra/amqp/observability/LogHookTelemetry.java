package com.amqploghook.infra.amqp.observability;

public interface LogHookTelemetry {
  void onPublishSuccess(String exchange, String routingKey, String level, long durationNanos);

  void onPublishFailure(
      String exchange, String routingKey, String level, String stage, Throwable error);
}
