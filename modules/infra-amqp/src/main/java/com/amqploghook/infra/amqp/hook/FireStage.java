package com.amqploghook.infra.amqp.hook;

public enum FireStage {
  CONNECT("connect to AMQP broker"),
  CHANNEL("open AMQP channel"),
  DECLARE("declare AMQP exchange"),
  FORMAT("format log entry"),
  PUBLISH("publish log entry");

  private final String action;

  FireStage(String action) {
    this.action = action;
  }

  public String action() {
    return action;
  }
}
