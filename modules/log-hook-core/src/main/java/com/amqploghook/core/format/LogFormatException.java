package com.amqploghook.core.format;

public class LogFormatException extends Exception {
  public LogFormatException(String message, Throwable cause) {
    super(message, cause);
  }

  public LogFormatException(String message) {
    super(message);
  }
}
