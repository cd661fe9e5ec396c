package com.amqploghook.core;

import java.util.List;
import java.util.Locale;

public enum LogLevel {
  PANIC("panic"),
  FATAL("fatal"),
  ERROR("error"),
  WARN("warning"),
  INFO("info"),
  DEBUG("debug");

  private static final List<LogLevel> ALL = List.of(values());

  private final String label;

  LogLevel(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public static List<LogLevel> all() {
    return ALL;
  }

  public static LogLevel parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Log level must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if ("warn".equals(normalized)) {
      return WARN;
    }
    for (LogLevel level : ALL) {
      if (level.label.equals(normalized)) {
        return level;
      }
    }
    throw new IllegalArgumentException("Not a valid log level: " + value);
  }

  @Override
  public String toString() {
    return label;
  }
}
