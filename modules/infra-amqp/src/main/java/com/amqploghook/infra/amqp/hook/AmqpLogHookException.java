package com.amqploghook.infra.amqp.hook;

public class AmqpLogHookException extends RuntimeException {
  private final FireStage stage;
  private final String exchange;
  private final String routingKey;

  public AmqpLogHookException(
      FireStage stage, String exchange, String routingKey, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
    this.exchange = exchange;
    this.routingKey = routingKey;
  }

  public FireStage stage() {
    return stage;
  }

  public String exchange() {
    return exchange;
  }

  public String routingKey() {
    return routingKey;
  }
}
