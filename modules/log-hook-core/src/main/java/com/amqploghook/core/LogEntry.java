package com.amqploghook.core;

import com.amqploghook.core.format.LogFormatter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single log event as handed to hooks.
 *
 * <p>{@code loggerFormatter} is the default formatter of the logger that produced the entry.
 * Hooks without their own formatter use it to render the entry.
 */
public record LogEntry(
    LogLevel level,
    String message,
    Map<String, Object> fields,
    Instant time,
    LogFormatter loggerFormatter) {
  public LogEntry {
    Objects.requireNonNull(level, "level must not be null");
    Objects.requireNonNull(time, "time must not be null");
    Objects.requireNonNull(loggerFormatter, "loggerFormatter must not be null");
    message = message == null ? "" : message;
    fields = copyFields(fields);
  }

  public static LogEntry of(LogLevel level, String message, LogFormatter loggerFormatter) {
    return new LogEntry(level, message, Map.of(), Instant.now(), loggerFormatter);
  }

  public LogEntry withField(String key, Object value) {
    Map<String, Object> merged = new LinkedHashMap<>(fields);
    merged.put(requireKey(key), value);
    return new LogEntry(level, message, merged, time, loggerFormatter);
  }

  public LogEntry withFields(Map<String, ?> additional) {
    Map<String, Object> merged = new LinkedHashMap<>(fields);
    if (additional != null) {
      additional.forEach((key, value) -> merged.put(requireKey(key), value));
    }
    return new LogEntry(level, message, merged, time, loggerFormatter);
  }

  private static Map<String, Object> copyFields(Map<String, Object> fields) {
    if (fields == null || fields.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    fields.forEach((key, value) -> copy.put(requireKey(key), value));
    return Collections.unmodifiableMap(copy);
  }

  private static String requireKey(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("field key must not be blank");
    }
    return key;
  }
}
